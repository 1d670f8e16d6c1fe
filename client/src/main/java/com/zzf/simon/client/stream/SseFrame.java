package com.zzf.simon.client.stream;

import lombok.Value;

/**
 * One dispatched server-sent event. {@code id} and {@code event} are null when the server omitted them.
 */
@Value
public class SseFrame {
    String id;
    String event;
    String data;
}
