package com.zzf.simon.tool;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Who performs a tool's side effect.
 */
public enum ToolOwner {
    /** Runs on the device after user confirmation. */
    CLIENT,
    /** Runs inside the execute call. */
    SERVER;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ToolOwner fromWire(String value) {
        return ToolOwner.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
