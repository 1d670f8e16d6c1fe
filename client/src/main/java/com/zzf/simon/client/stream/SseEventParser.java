package com.zzf.simon.client.stream;

import java.util.function.Consumer;

/**
 * Line-oriented {@code text/event-stream} parser. Feed it lines as they arrive; a blank line (or
 * {@link #finish}) dispatches the frame collected so far. Frames without data are dropped.
 */
public final class SseEventParser {
    private String currentId;
    private String currentEvent;
    private final StringBuilder currentData = new StringBuilder();

    public void acceptLine(String line, Consumer<SseFrame> handler) {
        if (line == null || handler == null) {
            return;
        }
        if (line.isBlank()) {
            flush(handler);
            return;
        }
        if (line.startsWith(":")) {
            return;
        }
        if (line.startsWith("id:")) {
            currentId = value(line, 3);
            return;
        }
        if (line.startsWith("event:")) {
            currentEvent = value(line, 6);
            return;
        }
        if (line.startsWith("data:")) {
            if (currentData.length() > 0) {
                currentData.append('\n');
            }
            currentData.append(value(line, 5));
        }
    }

    public void finish(Consumer<SseFrame> handler) {
        if (handler != null) {
            flush(handler);
        }
        reset();
    }

    private void reset() {
        currentId = null;
        currentEvent = null;
        currentData.setLength(0);
    }

    private void flush(Consumer<SseFrame> handler) {
        if (currentData.length() > 0) {
            handler.accept(new SseFrame(currentId, currentEvent, currentData.toString()));
        }
        reset();
    }

    // A single space after the colon belongs to the field syntax, not the value.
    private static String value(String line, int prefixLength) {
        String rest = line.substring(prefixLength);
        return rest.startsWith(" ") ? rest.substring(1) : rest;
    }
}
