package com.zzf.simon.client.stream;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

/**
 * Typed view of one stream envelope. The set of subclasses is closed; envelope types this client does not
 * know decode to {@link Unknown} and are meant to be ignored.
 */
@Getter
public abstract class StreamEvent {
    public static final String STREAM_OPEN = "stream.open";
    public static final String MESSAGE_DELTA = "message.delta";
    public static final String MESSAGE_FINAL = "message.final";
    public static final String CARD_NEXT_ACTIONS = "card.next_actions";
    public static final String CARD_PLAN = "card.plan";
    public static final String CARD_WEEKLY_REVIEW = "card.weekly_review";
    public static final String TOOL_REQUEST = "tool.request";
    public static final String TOOL_STATUS = "tool.status";
    public static final String POLICY_NOTICE = "policy.notice";
    public static final String ERROR = "error";
    public static final String STREAM_DONE = "stream.done";

    private final long id;
    private final String type;

    private StreamEvent(long id, String type) {
        this.id = id;
        this.type = type;
    }

    /** True for the last envelope of a stream. */
    public boolean isTerminal() {
        return false;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + ", type=" + type + "}";
    }

    @Getter
    public static final class StreamOpen extends StreamEvent {
        private final String sessionId;
        private final String serverTimeIso;

        public StreamOpen(long id, String sessionId, String serverTimeIso) {
            super(id, STREAM_OPEN);
            this.sessionId = sessionId;
            this.serverTimeIso = serverTimeIso;
        }
    }

    @Getter
    public static final class MessageDelta extends StreamEvent {
        private final String role;
        private final String delta;

        public MessageDelta(long id, String role, String delta) {
            super(id, MESSAGE_DELTA);
            this.role = role;
            this.delta = delta;
        }
    }

    @Getter
    public static final class MessageFinal extends StreamEvent {
        private final String messageId;
        private final String role;
        private final String text;
        private final int maxCards;

        public MessageFinal(long id, String messageId, String role, String text, int maxCards) {
            super(id, MESSAGE_FINAL);
            this.messageId = messageId;
            this.role = role;
            this.text = text;
            this.maxCards = maxCards;
        }
    }

    @Getter
    public static final class NextActionsCard extends StreamEvent {
        private final String schema;
        private final JsonNode items;

        public NextActionsCard(long id, String schema, JsonNode items) {
            super(id, CARD_NEXT_ACTIONS);
            this.schema = schema;
            this.items = items;
        }
    }

    @Getter
    public static final class PlanCard extends StreamEvent {
        private final String schema;
        private final JsonNode plan;

        public PlanCard(long id, String schema, JsonNode plan) {
            super(id, CARD_PLAN);
            this.schema = schema;
            this.plan = plan;
        }
    }

    @Getter
    public static final class WeeklyReviewCard extends StreamEvent {
        private final String schema;
        private final JsonNode review;

        public WeeklyReviewCard(long id, String schema, JsonNode review) {
            super(id, CARD_WEEKLY_REVIEW);
            this.schema = schema;
            this.review = review;
        }
    }

    @Getter
    public static final class ToolRequest extends StreamEvent {
        private final String requestId;
        private final String toolId;
        private final boolean requiresConfirmation;
        private final String reason;
        private final JsonNode input;

        public ToolRequest(long id, String requestId, String toolId, boolean requiresConfirmation, String reason, JsonNode input) {
            super(id, TOOL_REQUEST);
            this.requestId = requestId;
            this.toolId = toolId;
            this.requiresConfirmation = requiresConfirmation;
            this.reason = reason;
            this.input = input;
        }
    }

    @Getter
    public static final class ToolStatus extends StreamEvent {
        private final String toolRunId;
        private final String status;
        private final JsonNode output;
        private final String error;

        public ToolStatus(long id, String toolRunId, String status, JsonNode output, String error) {
            super(id, TOOL_STATUS);
            this.toolRunId = toolRunId;
            this.status = status;
            this.output = output;
            this.error = error;
        }
    }

    @Getter
    public static final class PolicyNotice extends StreamEvent {
        private final String kind;
        private final String message;

        public PolicyNotice(long id, String kind, String message) {
            super(id, POLICY_NOTICE);
            this.kind = kind;
            this.message = message;
        }
    }

    @Getter
    public static final class StreamError extends StreamEvent {
        private final String code;
        private final String message;

        public StreamError(long id, String code, String message) {
            super(id, ERROR);
            this.code = code;
            this.message = message;
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    @Getter
    public static final class StreamDone extends StreamEvent {
        private final String status;

        public StreamDone(long id, String status) {
            super(id, STREAM_DONE);
            this.status = status;
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    @Getter
    public static final class Unknown extends StreamEvent {
        private final JsonNode data;

        public Unknown(long id, String type, JsonNode data) {
            super(id, type);
            this.data = data;
        }
    }
}
