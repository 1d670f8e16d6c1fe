package com.zzf.simon.envelope;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One SSE frame. The id is assigned by the writer when the frame goes out, so ids on one connection are
 * 1, 2, 3... in write order; queued envelopes carry {@code -1}.
 */
public final class Envelope {
    private final long id;
    private final EventType type;
    private final JsonNode data;

    private Envelope(long id, EventType type, JsonNode data) {
        this.id = id;
        this.type = type;
        this.data = data;
    }

    public static Envelope of(EventType type, JsonNode data) {
        return new Envelope(-1, type, data);
    }

    public Envelope withId(long id) {
        return new Envelope(id, type, data);
    }

    public long getId() {
        return id;
    }

    public EventType getType() {
        return type;
    }

    public JsonNode getData() {
        return data;
    }

    public boolean isTerminal() {
        return type.isTerminal();
    }

    @Override
    public String toString() {
        return "Envelope{id=" + id + ", type=" + type.wire() + "}";
    }
}
