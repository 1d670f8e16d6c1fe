package com.zzf.simon.envelope;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of envelope types the server emits. Clients must ignore types they do not know.
 */
public enum EventType {
    STREAM_OPEN("stream.open"),
    MESSAGE_DELTA("message.delta"),
    MESSAGE_FINAL("message.final"),
    CARD_NEXT_ACTIONS("card.next_actions"),
    CARD_PLAN("card.plan"),
    CARD_WEEKLY_REVIEW("card.weekly_review"),
    TOOL_REQUEST("tool.request"),
    TOOL_STATUS("tool.status"),
    POLICY_NOTICE("policy.notice"),
    ERROR("error"),
    STREAM_DONE("stream.done");

    private final String wire;

    EventType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public boolean isTerminal() {
        return this == STREAM_DONE || this == ERROR;
    }
}
