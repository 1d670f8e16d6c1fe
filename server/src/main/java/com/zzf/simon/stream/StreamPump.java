package com.zzf.simon.stream;

import com.zzf.simon.config.SimonProperties;
import com.zzf.simon.envelope.Envelope;
import com.zzf.simon.envelope.EventType;
import com.zzf.simon.envelope.Payloads;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Writer loop for one connection. Waits on the connection's queue, the keep-alive interval, the wall-clock
 * budget and cancellation, and stops at whichever ends the stream first.
 */
@Slf4j
@Component
public class StreamPump {
    static final String KEEP_ALIVE_COMMENT = "keep-alive";

    private final Duration keepAlive;
    private final Duration timeout;
    private final MeterRegistry meterRegistry;
    private final AtomicInteger openConnections = new AtomicInteger();

    @Autowired
    public StreamPump(SimonProperties properties, MeterRegistry meterRegistry) {
        this(properties.getStream().getKeepAlive(), properties.getStream().getTimeout(), meterRegistry);
    }

    StreamPump(Duration keepAlive, Duration timeout, MeterRegistry meterRegistry) {
        this.keepAlive = keepAlive;
        this.timeout = timeout;
        this.meterRegistry = meterRegistry;
        meterRegistry.gauge("simon.stream.connections", openConnections);
    }

    public void pump(StreamConnection connection, FrameWriter writer) {
        long keepAliveNs = keepAlive.toNanos();
        long start = System.nanoTime();
        long deadline = start + timeout.toNanos();
        long lastWrite = start;
        long nextId = 1;
        openConnections.incrementAndGet();
        try {
            while (true) {
                if (connection.isCancelled()) {
                    log.info("stream.disconnected session={} written={}", connection.getSessionId(), nextId - 1);
                    return;
                }
                long now = System.nanoTime();
                if (now - deadline >= 0) {
                    connection.closeFromWriter();
                    writer.write(Envelope.of(EventType.ERROR,
                            Payloads.error("TIMEOUT", "Connection timeout after " + describe(timeout))).withId(nextId));
                    record(EventType.ERROR);
                    writer.complete();
                    log.warn("stream.timeout session={} budget={}", connection.getSessionId(), timeout);
                    return;
                }
                long untilKeepAlive = lastWrite + keepAliveNs - now;
                if (untilKeepAlive <= 0) {
                    writer.comment(KEEP_ALIVE_COMMENT);
                    lastWrite = System.nanoTime();
                    continue;
                }
                long waitNs = Math.min(untilKeepAlive, deadline - now);
                Envelope next = connection.poll(Math.max(1, TimeUnit.NANOSECONDS.toMillis(waitNs)));
                if (next == null || connection.isCancelled()) {
                    continue;
                }
                Envelope out = next.withId(nextId++);
                writer.write(out);
                record(out.getType());
                lastWrite = System.nanoTime();
                if (out.isTerminal()) {
                    writer.complete();
                    log.info("stream.closed session={} type={} written={}", connection.getSessionId(), out.getType().wire(), out.getId());
                    return;
                }
            }
        } catch (IOException e) {
            log.info("stream.write_failed session={} err={}", connection.getSessionId(), e.toString());
            connection.cancel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connection.cancel();
        } finally {
            openConnections.decrementAndGet();
        }
    }

    private void record(EventType type) {
        Counter.builder("simon.stream.envelopes").tag("type", type.wire()).register(meterRegistry).increment();
    }

    private static String describe(Duration d) {
        long seconds = d.getSeconds();
        if (seconds >= 60 && seconds % 60 == 0) {
            long minutes = seconds / 60;
            return minutes + (minutes == 1 ? " minute" : " minutes");
        }
        if (seconds > 0) {
            return seconds + (seconds == 1 ? " second" : " seconds");
        }
        return d.toMillis() + " ms";
    }

    int openConnections() {
        return openConnections.get();
    }
}
