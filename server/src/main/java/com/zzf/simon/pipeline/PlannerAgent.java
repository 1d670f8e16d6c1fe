package com.zzf.simon.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.simon.llm.LlmService;
import com.zzf.simon.tool.server.PlanService;
import com.zzf.simon.util.ModelOutput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Extracts plan, next-action and weekly-review cards from the coach reply. A reply the model cannot
 * structure yields no cards; a failed model call propagates as {@link com.zzf.simon.llm.LlmException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlannerAgent {
    static final int MAX_STANDALONE_ACTIONS = 7;
    private static final Set<String> ENERGY = Set.of("low", "medium", "high");
    private static final Set<String> WHEN_KINDS = Set.of("now", "today_window", "schedule_exact");

    private static final String EXTRACT_PROMPT = "Extract structured data from this coaching response.\n" +
            "Return JSON only with any of these keys that apply:\n" +
            "  \"plan\": {\"title\", \"objective\", \"horizon\": today|week|month|quarter, \"milestones\": [{\"label\", \"due_date_hint\", \"success_metric\"}], \"next_actions\": [...]}\n" +
            "  \"next_actions\": [{\"id\", \"title\", \"duration_min\", \"energy\": low|medium|high, \"when\": {\"kind\": now|today_window|schedule_exact, \"start_iso\", \"end_iso\"}}]\n" +
            "  \"weekly_review\": {\"wins\": [], \"misses\": [], \"root_causes\": [], \"next_week_focus\": [], \"commitments\": []}\n" +
            "Limits: 8 milestones and 12 next actions per plan, 7 standalone next actions.\n" +
            "If nothing applies return {}.\n" +
            "Coach response:\n";

    private final LlmService llm;
    private final ObjectMapper objectMapper;

    public PlannerOutput extract(String reply) {
        String raw = llm.complete(EXTRACT_PROMPT + ModelOutput.truncate(reply, 8000));
        JsonNode root;
        try {
            root = objectMapper.readTree(ModelOutput.firstJsonObject(raw));
        } catch (Exception e) {
            log.info("planner.parse.empty err={}", e.toString());
            return PlannerOutput.empty();
        }
        ObjectNode plan = root.path("plan").isObject() ? capPlan((ObjectNode) root.get("plan").deepCopy()) : null;
        ArrayNode actions = root.path("next_actions").isArray() && root.get("next_actions").size() > 0
                ? normalizeActions((ArrayNode) root.get("next_actions").deepCopy())
                : null;
        ObjectNode review = root.path("weekly_review").isObject() ? (ObjectNode) root.get("weekly_review").deepCopy() : null;
        log.info("planner.extract plan={} actions={} review={}", plan != null, actions == null ? 0 : actions.size(), review != null);
        return new PlannerOutput(plan, actions, review);
    }

    static ObjectNode capPlan(ObjectNode plan) {
        truncate(plan.path("milestones"), PlanService.MAX_MILESTONES);
        truncate(plan.path("next_actions"), PlanService.MAX_NEXT_ACTIONS);
        return plan;
    }

    static ArrayNode normalizeActions(ArrayNode actions) {
        truncate(actions, MAX_STANDALONE_ACTIONS);
        for (int i = 0; i < actions.size(); i++) {
            if (!actions.get(i).isObject()) {
                continue;
            }
            ObjectNode action = (ObjectNode) actions.get(i);
            if (action.path("id").asText("").isBlank()) {
                action.put("id", "na_" + (i + 1));
            }
            if (!ENERGY.contains(action.path("energy").asText())) {
                action.put("energy", "medium");
            }
            ObjectNode when = action.path("when").isObject() ? (ObjectNode) action.get("when") : action.putObject("when");
            if (!WHEN_KINDS.contains(when.path("kind").asText())) {
                when.put("kind", "now");
            }
        }
        return actions;
    }

    private static void truncate(JsonNode node, int max) {
        if (node instanceof ArrayNode) {
            ArrayNode array = (ArrayNode) node;
            while (array.size() > max) {
                array.remove(array.size() - 1);
            }
        }
    }
}
