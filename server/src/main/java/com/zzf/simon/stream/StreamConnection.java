package com.zzf.simon.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.simon.envelope.Envelope;
import com.zzf.simon.envelope.EventType;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Buffered channel between one producer and one writer. After a terminal envelope is queued, or after
 * {@link #cancel()}, further emits are dropped.
 */
@Slf4j
public class StreamConnection implements EnvelopeSink {
    private static final long OFFER_WAIT_MS = 200;

    private final String sessionId;
    private final BlockingQueue<Envelope> queue;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean terminalQueued = new AtomicBoolean(false);

    public StreamConnection(String sessionId, int bufferSize) {
        this.sessionId = sessionId;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, bufferSize));
    }

    @Override
    public boolean emit(EventType type, JsonNode data) {
        if (cancelled.get() || terminalQueued.get()) {
            return false;
        }
        if (type.isTerminal() && !terminalQueued.compareAndSet(false, true)) {
            return false;
        }
        Envelope envelope = Envelope.of(type, data);
        try {
            while (!cancelled.get()) {
                if (queue.offer(envelope, OFFER_WAIT_MS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    @Override
    public boolean isOpen() {
        return !cancelled.get() && !terminalQueued.get();
    }

    /**
     * Called on client disconnect, emitter timeout or writer failure. Idempotent.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            queue.clear();
            log.info("stream.cancel session={}", sessionId);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    Envelope poll(long timeoutMs) throws InterruptedException {
        return queue.poll(timeoutMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Marks the connection finished from the writer side, e.g. after the wall-clock budget ran out.
     */
    void closeFromWriter() {
        terminalQueued.set(true);
        cancelled.set(true);
        queue.clear();
    }

    public String getSessionId() {
        return sessionId;
    }
}
