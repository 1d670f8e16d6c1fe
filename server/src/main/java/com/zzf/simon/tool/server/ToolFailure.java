package com.zzf.simon.tool.server;

/**
 * Business rejection inside a server tool. The run is stored as failed with this message.
 */
public class ToolFailure extends RuntimeException {
    public ToolFailure(String message) {
        super(message);
    }
}
