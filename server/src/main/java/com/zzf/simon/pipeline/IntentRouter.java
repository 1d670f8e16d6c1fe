package com.zzf.simon.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.simon.llm.LlmService;
import com.zzf.simon.util.ModelOutput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Keyword rules first, then the classifier model. Model failures propagate; unusable model output
 * falls back to {@link Route#QUICK_NUDGE}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntentRouter {
    static final double FALLBACK_CONFIDENCE = 0.5;

    private static final Pattern SCHEDULING = Pattern.compile("(?i)\\b(schedule|remind(er)?|calendar)\\b");
    private static final Pattern REVIEW = Pattern.compile("(?i)\\b(review|retro|retrospective|my week|this week|last week)\\b");
    private static final Pattern SYSTEM = Pattern.compile("(?i)\\b(system|routine|habit)s?\\b");

    private static final String CLASSIFY_PROMPT = "Classify the user's intent into one of these routes:\n" +
            "- quick_nudge: a quick tip or small next step (\"I'm stuck\", \"give me a quick win\")\n" +
            "- deep_session: working through a problem in depth (\"help me think through this\")\n" +
            "- make_a_system: building a repeatable routine (\"I need a system for X\")\n" +
            "- review_retro: reviewing progress (\"let's review my week\")\n" +
            "- scheduling: scheduling something specific (\"remind me to X\")\n" +
            "\n" +
            "Respond with JSON only: {\"route\": \"...\", \"confidence\": 0.0-1.0}\n" +
            "If unsure, answer quick_nudge with confidence 0.5.\n" +
            "User message: ";

    private final LlmService llm;
    private final ObjectMapper objectMapper;

    public RouteDecision classify(String message) {
        String q = message == null ? "" : message.trim();
        Optional<Route> byRule = matchRule(q);
        if (byRule.isPresent()) {
            log.info("router.rule route={} q={}", byRule.get().wire(), ModelOutput.truncate(q, 50));
            return new RouteDecision(byRule.get(), 1.0, RouteDecision.Source.RULE);
        }

        long t0 = System.nanoTime();
        String raw = llm.complete(CLASSIFY_PROMPT + ModelOutput.truncate(q, 1000));
        RouteDecision decision = parse(raw);
        log.info("router.model route={} confidence={} source={} tookMs={}",
                decision.getRoute().wire(), decision.getConfidence(), decision.getSource(), (System.nanoTime() - t0) / 1_000_000L);
        return decision;
    }

    static Optional<Route> matchRule(String q) {
        if (SCHEDULING.matcher(q).find()) {
            return Optional.of(Route.SCHEDULING);
        }
        if (REVIEW.matcher(q).find()) {
            return Optional.of(Route.REVIEW_RETRO);
        }
        if (SYSTEM.matcher(q).find()) {
            return Optional.of(Route.MAKE_A_SYSTEM);
        }
        return Optional.empty();
    }

    RouteDecision parse(String raw) {
        try {
            JsonNode node = objectMapper.readTree(ModelOutput.firstJsonObject(raw));
            Optional<Route> route = Route.fromWire(node.path("route").asText(null));
            if (route.isEmpty()) {
                return fallback();
            }
            double confidence = node.path("confidence").asDouble(FALLBACK_CONFIDENCE);
            return new RouteDecision(route.get(), Math.max(0.0, Math.min(1.0, confidence)), RouteDecision.Source.MODEL);
        } catch (Exception e) {
            log.debug("router.parse.fail err={}", e.toString());
            return fallback();
        }
    }

    private static RouteDecision fallback() {
        return new RouteDecision(Route.QUICK_NUDGE, FALLBACK_CONFIDENCE, RouteDecision.Source.FALLBACK);
    }
}
