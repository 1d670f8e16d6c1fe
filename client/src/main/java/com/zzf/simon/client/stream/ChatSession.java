package com.zzf.simon.client.stream;

import com.zzf.simon.client.SimonApiClient;
import com.zzf.simon.client.SimonApiException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Drives chat turns for one session. Each {@link #send} owns one {@link ChatStream}; {@link #stop()}
 * cancels it, and a new send stops the turn before it.
 */
@Slf4j
public class ChatSession {
    private final SimonApiClient api;
    private final String sessionId;
    private final Executor executor;
    private final Duration idleTimeout;
    private final Object lock = new Object();
    private volatile ToolRequestHandler toolRequestHandler;
    private ChatStream current;

    public ChatSession(SimonApiClient api, String sessionId, Executor executor, Duration idleTimeout) {
        this.api = api;
        this.sessionId = sessionId;
        this.executor = executor;
        this.idleTimeout = idleTimeout;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setToolRequestHandler(ToolRequestHandler handler) {
        this.toolRequestHandler = handler;
    }

    public CompletableFuture<TurnResult> send(String message, ChatListener listener) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message is required");
        }
        ChatStream stream;
        synchronized (lock) {
            stop();
            stream = api.streamChat(sessionId, message);
            current = stream;
        }
        ChatListener target = listener == null ? new ChatListener() { } : listener;
        return CompletableFuture.supplyAsync(() -> drive(stream, target), executor);
    }

    /**
     * Cancels the running turn, if any. The turn's future completes with {@link TurnResult.Status#CANCELLED}.
     */
    public void stop() {
        synchronized (lock) {
            if (current != null) {
                current.cancel();
                current = null;
                log.info("chat.stop session={}", sessionId);
            }
        }
    }

    private TurnResult drive(ChatStream stream, ChatListener listener) {
        TurnResult.TurnResultBuilder result = TurnResult.builder().status(TurnResult.Status.FAILED);
        StringBuilder text = new StringBuilder();
        boolean finalSeen = false;
        try {
            Optional<StreamEvent> next;
            while ((next = stream.next(idleTimeout)).isPresent()) {
                StreamEvent event = next.get();
                if (event instanceof StreamEvent.StreamOpen) {
                    listener.onOpen((StreamEvent.StreamOpen) event);
                } else if (event instanceof StreamEvent.MessageDelta) {
                    StreamEvent.MessageDelta delta = (StreamEvent.MessageDelta) event;
                    text.append(delta.getDelta());
                    listener.onDelta(delta, text.toString());
                } else if (event instanceof StreamEvent.MessageFinal) {
                    StreamEvent.MessageFinal message = (StreamEvent.MessageFinal) event;
                    if (text.length() > 0 && !text.toString().equals(message.getText())) {
                        log.warn("chat.delta_mismatch session={} message={} deltas={} final={}",
                                sessionId, message.getMessageId(), text.length(), message.getText().length());
                    }
                    finalSeen = true;
                    result.messageId(message.getMessageId()).text(message.getText());
                    listener.onFinal(message);
                } else if (event instanceof StreamEvent.NextActionsCard
                        || event instanceof StreamEvent.PlanCard
                        || event instanceof StreamEvent.WeeklyReviewCard) {
                    listener.onCard(event);
                } else if (event instanceof StreamEvent.ToolRequest) {
                    StreamEvent.ToolRequest request = (StreamEvent.ToolRequest) event;
                    result.toolRequest(request);
                    listener.onToolRequest(request);
                    dispatchToolRequest(request);
                } else if (event instanceof StreamEvent.ToolStatus) {
                    listener.onToolStatus((StreamEvent.ToolStatus) event);
                } else if (event instanceof StreamEvent.PolicyNotice) {
                    listener.onNotice((StreamEvent.PolicyNotice) event);
                } else if (event instanceof StreamEvent.StreamError) {
                    StreamEvent.StreamError error = (StreamEvent.StreamError) event;
                    result.status(TurnResult.Status.FAILED).errorCode(error.getCode()).errorMessage(error.getMessage());
                    listener.onError(error);
                } else if (event instanceof StreamEvent.StreamDone) {
                    result.status(TurnResult.Status.COMPLETED);
                } else {
                    log.debug("chat.ignored_event session={} type={}", sessionId, event.getType());
                }
            }
            if (stream.isCancelled()) {
                result.status(TurnResult.Status.CANCELLED);
            }
        } catch (SimonApiException e) {
            result.status(TurnResult.Status.FAILED).errorCode(e.getCode()).errorMessage(e.getMessage());
            listener.onFailure(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stream.cancel();
            result.status(TurnResult.Status.CANCELLED);
        } finally {
            synchronized (lock) {
                if (current == stream) {
                    current = null;
                }
            }
        }
        if (!finalSeen) {
            result.text(text.toString());
        }
        return result.build();
    }

    private void dispatchToolRequest(StreamEvent.ToolRequest request) {
        ToolRequestHandler handler = toolRequestHandler;
        if (handler == null) {
            return;
        }
        try {
            handler.handle(request, sessionId);
        } catch (RuntimeException e) {
            log.warn("chat.tool_handler_failed session={} tool={} msg={}", sessionId, request.getToolId(), e.getMessage());
        }
    }
}
