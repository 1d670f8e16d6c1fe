package com.zzf.simon.tool.server;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of a server-owned tool: either output (executed) or an error message (failed).
 */
public final class ServerToolResult {
    private final JsonNode output;
    private final String error;

    private ServerToolResult(JsonNode output, String error) {
        this.output = output;
        this.error = error;
    }

    public static ServerToolResult executed(JsonNode output) {
        return new ServerToolResult(output, null);
    }

    public static ServerToolResult failed(String error) {
        return new ServerToolResult(null, error);
    }

    public boolean isExecuted() {
        return error == null;
    }

    public JsonNode getOutput() {
        return output;
    }

    public String getError() {
        return error;
    }
}
