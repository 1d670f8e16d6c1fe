package com.zzf.simon.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.simon.envelope.EventType;

/**
 * Producer side of a stream connection.
 */
public interface EnvelopeSink {

    /**
     * Queues an envelope for the writer.
     *
     * @return false when the connection is already closed and nothing was queued
     */
    boolean emit(EventType type, JsonNode data);

    boolean isOpen();
}
