package com.zzf.simon.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Payload shapes for each {@link EventType}.
 */
public final class Payloads {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public static final String PLAN_SCHEMA = "Plan.v1";
    public static final String NEXT_ACTION_SCHEMA = "NextAction.v1";
    public static final String WEEKLY_REVIEW_SCHEMA = "WeeklyReview.v1";
    public static final int MAX_CARDS = 3;

    private Payloads() {
    }

    public static ObjectNode streamOpen(String sessionId, String serverTimeIso) {
        ObjectNode node = NODES.objectNode();
        node.put("session_id", sessionId);
        node.put("server_time_iso", serverTimeIso);
        return node;
    }

    public static ObjectNode messageDelta(String delta) {
        ObjectNode node = NODES.objectNode();
        node.put("role", "assistant");
        node.put("delta", delta);
        return node;
    }

    public static ObjectNode messageFinal(String messageId, String text) {
        ObjectNode node = NODES.objectNode();
        node.put("message_id", messageId);
        node.put("role", "assistant");
        node.put("text", text);
        node.putObject("render_hints").put("max_cards", MAX_CARDS);
        return node;
    }

    public static ObjectNode planCard(JsonNode plan) {
        ObjectNode node = NODES.objectNode();
        node.put("schema", PLAN_SCHEMA);
        node.set("plan", plan);
        return node;
    }

    public static ObjectNode nextActionsCard(ArrayNode items) {
        ObjectNode node = NODES.objectNode();
        node.put("schema", NEXT_ACTION_SCHEMA);
        node.set("items", items);
        return node;
    }

    public static ObjectNode weeklyReviewCard(JsonNode review) {
        ObjectNode node = NODES.objectNode();
        node.put("schema", WEEKLY_REVIEW_SCHEMA);
        node.set("review", review);
        return node;
    }

    /**
     * {@code tool} duplicates {@code tool_id} for older clients.
     */
    public static ObjectNode toolRequest(String requestId, String toolId, boolean requiresConfirmation, String reason, JsonNode input) {
        ObjectNode node = NODES.objectNode();
        node.put("request_id", requestId);
        node.put("tool_id", toolId);
        node.put("tool", toolId);
        node.put("requires_confirmation", requiresConfirmation);
        node.put("reason", reason);
        node.set("input", input);
        return node;
    }

    public static ObjectNode policyNotice(String kind, String message) {
        ObjectNode node = NODES.objectNode();
        node.put("kind", kind);
        node.put("message", message);
        return node;
    }

    public static ObjectNode error(String code, String message) {
        ObjectNode node = NODES.objectNode();
        node.put("code", code);
        node.put("message", message);
        return node;
    }

    public static ObjectNode streamDone(String status) {
        ObjectNode node = NODES.objectNode();
        node.put("status", status);
        return node;
    }
}
