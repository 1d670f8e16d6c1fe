package com.zzf.simon.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.simon.envelope.Envelope;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

public final class SseEmitterFrameWriter implements FrameWriter {
    private final SseEmitter emitter;
    private final ObjectMapper objectMapper;

    public SseEmitterFrameWriter(SseEmitter emitter, ObjectMapper objectMapper) {
        this.emitter = emitter;
        this.objectMapper = objectMapper;
    }

    @Override
    public void write(Envelope envelope) throws IOException {
        String json = objectMapper.writeValueAsString(envelope.getData());
        synchronized (emitter) {
            emitter.send(SseEmitter.event()
                    .id(String.valueOf(envelope.getId()))
                    .name(envelope.getType().wire())
                    .data(json));
        }
    }

    @Override
    public void comment(String text) throws IOException {
        synchronized (emitter) {
            emitter.send(SseEmitter.event().comment(text));
        }
    }

    @Override
    public void complete() {
        synchronized (emitter) {
            emitter.complete();
        }
    }
}
