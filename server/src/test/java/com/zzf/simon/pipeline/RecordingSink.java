package com.zzf.simon.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.simon.envelope.EventType;
import com.zzf.simon.stream.EnvelopeSink;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

class RecordingSink implements EnvelopeSink {
    final List<EventType> types = new ArrayList<>();
    final List<JsonNode> payloads = new ArrayList<>();
    volatile boolean open = true;
    /** When non-negative, the number of {@link #isOpen()} checks answered before the sink closes itself. */
    int openChecksLeft = -1;

    @Override
    public synchronized boolean emit(EventType type, JsonNode data) {
        if (!open) {
            return false;
        }
        types.add(type);
        payloads.add(data);
        return true;
    }

    @Override
    public synchronized boolean isOpen() {
        if (openChecksLeft == 0) {
            open = false;
        } else if (openChecksLeft > 0) {
            openChecksLeft--;
        }
        return open;
    }

    synchronized List<JsonNode> payloadsOf(EventType type) {
        List<JsonNode> out = new ArrayList<>();
        for (int i = 0; i < types.size(); i++) {
            if (types.get(i) == type) {
                out.add(payloads.get(i));
            }
        }
        return out;
    }

    synchronized String deltaText() {
        return payloadsOf(EventType.MESSAGE_DELTA).stream()
                .map(p -> p.path("delta").asText())
                .collect(Collectors.joining());
    }
}
