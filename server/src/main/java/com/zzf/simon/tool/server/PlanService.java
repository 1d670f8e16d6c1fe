package com.zzf.simon.tool.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.simon.id.Identifier;
import com.zzf.simon.id.Timestamps;
import com.zzf.simon.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Plans are kept as JSON documents in collection {@code plans}; updates may touch any top-level key.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlanService {
    public static final int MAX_MILESTONES = 8;
    public static final int MAX_NEXT_ACTIONS = 12;
    static final String COLLECTION = "plans";
    private static final int DEFAULT_LIMIT = 10;
    private static final Set<String> PROTECTED_KEYS = Set.of("id", "uid", "created_at");

    private final DocumentStore store;

    public ObjectNode create(String uid, String coachId, JsonNode planInput) {
        ObjectNode plan = planInput.deepCopy();
        checkCaps(plan);
        if (plan.path("title").asText("").isBlank()) {
            throw new ToolFailure("plan title is required");
        }
        if (plan.path("objective").asText("").isBlank()) {
            throw new ToolFailure("plan objective is required");
        }
        String now = Timestamps.now();
        String planId = Identifier.random("plan");
        plan.put("id", planId);
        plan.put("uid", uid);
        plan.put("coach_id", coachId);
        plan.put("status", "active");
        plan.put("created_at", now);
        plan.put("updated_at", now);
        assignIds(plan.path("milestones"), "milestone");
        assignIds(plan.path("next_actions"), "action");
        store.put(COLLECTION, planId, plan);
        log.info("plan.create uid={} plan={}", uid, planId);

        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("plan_id", planId);
        result.put("status", "created");
        return result;
    }

    public ObjectNode update(String uid, String planId, JsonNode updates) {
        checkCaps(updates);
        store.update(COLLECTION, planId, ObjectNode.class, plan -> {
            if (!uid.equals(plan.path("uid").asText())) {
                throw new ToolFailure("unauthorized: plan belongs to different user");
            }
            Iterator<String> keys = updates.fieldNames();
            while (keys.hasNext()) {
                String key = keys.next();
                if (!PROTECTED_KEYS.contains(key)) {
                    plan.set(key, updates.get(key));
                }
            }
            plan.put("updated_at", Timestamps.now());
            return plan;
        }).orElseThrow(() -> new ToolFailure("plan not found: " + planId));
        log.info("plan.update uid={} plan={}", uid, planId);

        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("status", "updated");
        return result;
    }

    public List<ObjectNode> listActive(String uid, int limit) {
        int max = limit > 0 ? limit : DEFAULT_LIMIT;
        return store.list(COLLECTION, ObjectNode.class).stream()
                .filter(p -> uid.equals(p.path("uid").asText()))
                .filter(p -> "active".equals(p.path("status").asText()))
                .sorted(Comparator.comparing((ObjectNode p) -> Timestamps.parseOrEpoch(p.path("created_at").asText(null))).reversed())
                .limit(max)
                .collect(Collectors.toList());
    }

    public ObjectNode listActiveOutput(String uid, int limit) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        ArrayNode plans = result.putArray("plans");
        listActive(uid, limit).forEach(plans::add);
        return result;
    }

    private static void checkCaps(JsonNode plan) {
        if (plan.path("milestones").size() > MAX_MILESTONES) {
            throw new ToolFailure("too many milestones (max " + MAX_MILESTONES + ", got " + plan.path("milestones").size() + ")");
        }
        if (plan.path("next_actions").size() > MAX_NEXT_ACTIONS) {
            throw new ToolFailure("too many next actions (max " + MAX_NEXT_ACTIONS + ", got " + plan.path("next_actions").size() + ")");
        }
    }

    private static void assignIds(JsonNode items, String prefix) {
        int n = 0;
        for (JsonNode item : items) {
            n++;
            if (!(item instanceof ObjectNode)) {
                continue;
            }
            ObjectNode node = (ObjectNode) item;
            if (node.path("id").asText("").isBlank()) {
                node.put("id", prefix + "_" + n);
            }
            if (node.path("status").asText("").isBlank()) {
                node.put("status", "pending");
            }
        }
    }
}
