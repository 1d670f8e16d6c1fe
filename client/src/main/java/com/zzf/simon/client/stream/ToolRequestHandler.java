package com.zzf.simon.client.stream;

@FunctionalInterface
public interface ToolRequestHandler {
    void handle(StreamEvent.ToolRequest request, String sessionId);
}
