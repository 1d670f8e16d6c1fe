package com.zzf.simon.tool;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ToolRunStatus {
    PENDING,
    EXECUTED,
    FAILED,
    DECLINED;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * @return null for unknown values so callers can report a validation error
     */
    @JsonCreator
    public static ToolRunStatus fromWire(String value) {
        if (value == null) {
            return null;
        }
        for (ToolRunStatus status : values()) {
            if (status.wire().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return status;
            }
        }
        return null;
    }
}
