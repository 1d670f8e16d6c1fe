package com.zzf.simon.pipeline;

import com.zzf.simon.envelope.EventType;
import com.zzf.simon.envelope.Payloads;
import com.zzf.simon.llm.LlmService;
import com.zzf.simon.stream.EnvelopeSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Streams the coach reply as {@code message.delta} envelopes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CoachAgent {
    private final LlmService llm;

    /**
     * @return the full reply, equal to the concatenation of the emitted deltas
     */
    public String reply(CoachContext context, String userMessage, EnvelopeSink sink) {
        long t0 = System.nanoTime();
        String text = llm.stream(PromptBuilder.messages(context, userMessage),
                new LlmService.StreamCallback() {
                    @Override
                    public void onDelta(String delta) {
                        sink.emit(EventType.MESSAGE_DELTA, Payloads.messageDelta(delta));
                    }
                },
                () -> !sink.isOpen());
        log.info("coach.reply coach={} chars={} tookMs={}", context.getBlueprint().getId(), text.length(),
                (System.nanoTime() - t0) / 1_000_000L);
        return text;
    }
}
