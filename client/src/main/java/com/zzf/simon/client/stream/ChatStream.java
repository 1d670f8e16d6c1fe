package com.zzf.simon.client.stream;

import com.zzf.simon.client.SimonApiException;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * One chat turn's envelope sequence. A background reader parses the response body into a queue; callers
 * pull with {@link #next(Duration)} or {@link #forEach(Consumer)}. The sequence ends after
 * {@code stream.done} or {@code error}. After {@link #cancel()} it ends quietly, without an exception.
 */
@Slf4j
public final class ChatStream implements AutoCloseable {

    /**
     * Opens the response body. Non-2xx answers and transport failures surface as {@link SimonApiException}.
     */
    @FunctionalInterface
    public interface Connector {
        Stream<String> connect();
    }

    private static final class Item {
        private static final Item CANCELLED = new Item(null, null);

        final StreamEvent event;
        final SimonApiException failure;

        Item(StreamEvent event, SimonApiException failure) {
            this.event = event;
            this.failure = failure;
        }

        boolean isEnd() {
            return event == null;
        }
    }

    private final Connector connector;
    private final EnvelopeDecoder decoder;
    private final int connectAttempts;
    private final Duration retryDelay;
    private final Duration idleTimeout;
    private final BlockingQueue<Item> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile Stream<String> body;
    private volatile Future<?> reader;
    private boolean sawTerminal;
    private boolean finished;

    ChatStream(Connector connector, EnvelopeDecoder decoder, int connectAttempts, Duration retryDelay, Duration idleTimeout) {
        this.connector = connector;
        this.decoder = decoder;
        this.connectAttempts = Math.max(1, connectAttempts);
        this.retryDelay = retryDelay;
        this.idleTimeout = idleTimeout;
    }

    public static ChatStream start(Connector connector,
                                   EnvelopeDecoder decoder,
                                   ExecutorService executor,
                                   int connectAttempts,
                                   Duration retryDelay,
                                   Duration idleTimeout) {
        ChatStream stream = new ChatStream(connector, decoder, connectAttempts, retryDelay, idleTimeout);
        stream.reader = executor.submit(stream::read);
        return stream;
    }

    /**
     * Next event, or empty once the stream has ended or was cancelled.
     *
     * @throws SimonApiException when the connection failed or nothing arrived within {@code timeout}
     */
    public Optional<StreamEvent> next(Duration timeout) throws InterruptedException {
        if (finished || cancelled.get()) {
            finished = true;
            return Optional.empty();
        }
        Item item = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (cancelled.get()) {
            finished = true;
            return Optional.empty();
        }
        if (item == null) {
            cancel();
            throw SimonApiException.network("no envelope received within " + timeout.toSeconds() + "s", null);
        }
        if (item.isEnd()) {
            finished = true;
            if (item.failure != null) {
                throw item.failure;
            }
            return Optional.empty();
        }
        return Optional.of(item.event);
    }

    public void forEach(Consumer<StreamEvent> consumer) throws InterruptedException {
        Optional<StreamEvent> event;
        while ((event = next(idleTimeout)).isPresent()) {
            consumer.accept(event.get());
        }
    }

    /**
     * Stops reading and releases the connection. Safe to call more than once and from any thread.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        closeBody();
        Future<?> task = reader;
        if (task != null) {
            task.cancel(true);
        }
        queue.clear();
        queue.offer(Item.CANCELLED);
        log.debug("stream.cancelled");
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public void close() {
        cancel();
    }

    private void read() {
        SimonApiException failure = null;
        try {
            Stream<String> lines = connectWithRetry();
            if (lines == null) {
                return;
            }
            body = lines;
            if (cancelled.get()) {
                return;
            }
            SseEventParser parser = new SseEventParser();
            Iterator<String> it = lines.iterator();
            while (!sawTerminal && !cancelled.get() && it.hasNext()) {
                parser.acceptLine(it.next(), this::dispatch);
            }
            if (!sawTerminal && !cancelled.get()) {
                parser.finish(this::dispatch);
            }
            if (!sawTerminal && !cancelled.get()) {
                failure = SimonApiException.network("stream closed before a terminal envelope", null);
            }
        } catch (SimonApiException e) {
            failure = e;
        } catch (UncheckedIOException e) {
            failure = SimonApiException.network("stream read failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            closeBody();
            if (cancelled.get()) {
                failure = null;
            } else if (failure != null) {
                log.warn("stream.failed kind={} code={} msg={}", failure.getKind(), failure.getCode(), failure.getMessage());
            }
            queue.offer(new Item(null, failure));
        }
    }

    private Stream<String> connectWithRetry() throws InterruptedException {
        for (int attempt = 1; ; attempt++) {
            if (cancelled.get()) {
                return null;
            }
            try {
                return connector.connect();
            } catch (SimonApiException e) {
                if (!e.isTransient() || attempt >= connectAttempts || cancelled.get()) {
                    throw e;
                }
                log.warn("stream.connect_retry attempt={}/{} kind={} msg={}", attempt, connectAttempts, e.getKind(), e.getMessage());
                Thread.sleep(retryDelay.toMillis());
            }
        }
    }

    private void dispatch(SseFrame frame) {
        decoder.decode(frame).ifPresent(event -> {
            if (!cancelled.get()) {
                queue.offer(new Item(event, null));
            }
            if (event.isTerminal()) {
                sawTerminal = true;
            }
        });
    }

    private void closeBody() {
        Stream<String> lines = body;
        if (lines != null) {
            try {
                lines.close();
            } catch (RuntimeException e) {
                log.debug("stream.close_failed msg={}", e.getMessage());
            }
        }
    }
}
