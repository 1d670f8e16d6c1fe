package com.zzf.simon.llm;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Blocking facade over the streaming and classifier models. Callers run on a stream worker thread.
 */
@Slf4j
@Service
public class LlmService {
    private static final long POLL_MS = 200;

    private final StreamingChatModel streamingModel;
    private final ChatModel classifierModel;

    public LlmService(@Qualifier("coachStreamingModel") StreamingChatModel streamingModel,
                      @Qualifier("classifierModel") ChatModel classifierModel) {
        this.streamingModel = streamingModel;
        this.classifierModel = classifierModel;
    }

    public interface StreamCallback {
        default void onDelta(String delta) {}
    }

    /**
     * Streams a reply, forwarding each partial response to {@code callback}.
     *
     * @return the concatenation of all deltas, which is exactly what the callback saw
     * @throws CancellationException when {@code cancelled} turns true before completion
     * @throws LlmException on model failure
     */
    public String stream(List<ChatMessage> messages, StreamCallback callback, BooleanSupplier cancelled) {
        StringBuilder text = new StringBuilder();
        CompletableFuture<ChatResponse> done = new CompletableFuture<>();
        try {
            streamingModel.chat(messages, new StreamingChatResponseHandler() {
                @Override
                public void onPartialResponse(String partial) {
                    if (partial == null || partial.isEmpty() || cancelled.getAsBoolean() || done.isDone()) {
                        return;
                    }
                    synchronized (text) {
                        text.append(partial);
                    }
                    callback.onDelta(partial);
                }

                @Override
                public void onCompleteResponse(ChatResponse response) {
                    done.complete(response);
                }

                @Override
                public void onError(Throwable error) {
                    done.completeExceptionally(error);
                }
            });
        } catch (RuntimeException e) {
            throw new LlmException("model stream failed to start: " + e.getMessage(), e);
        }

        ChatResponse response = await(done, cancelled);
        synchronized (text) {
            if (text.length() == 0 && response != null && response.aiMessage() != null && response.aiMessage().text() != null) {
                // model returned no partials; surface the whole reply as one delta
                String whole = response.aiMessage().text();
                text.append(whole);
                callback.onDelta(whole);
            }
            return text.toString();
        }
    }

    /**
     * One-shot completion on the classifier model.
     */
    public String complete(String prompt) {
        try {
            return classifierModel.chat(prompt);
        } catch (RuntimeException e) {
            throw new LlmException("classifier call failed: " + e.getMessage(), e);
        }
    }

    private static ChatResponse await(CompletableFuture<ChatResponse> done, BooleanSupplier cancelled) {
        while (true) {
            if (cancelled.getAsBoolean()) {
                done.cancel(true);
                throw new CancellationException("model stream cancelled");
            }
            try {
                return done.get(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                // poll again
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("model stream interrupted");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("llm.stream.error error={}", cause.toString());
                throw new LlmException("model stream failed: " + cause.getMessage(), cause);
            }
        }
    }
}
