package com.zzf.simon.client.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Turns SSE frames into {@link StreamEvent}s. A frame whose data is not a JSON object is logged and
 * skipped so one bad line never ends the stream.
 */
@Slf4j
public final class EnvelopeDecoder {
    private final ObjectMapper mapper;

    public EnvelopeDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Optional<StreamEvent> decode(SseFrame frame) {
        if (frame == null || frame.getData() == null) {
            return Optional.empty();
        }
        JsonNode data;
        try {
            data = mapper.readTree(frame.getData());
        } catch (JsonProcessingException e) {
            log.warn("stream.decode_failed id={} event={} msg={}", frame.getId(), frame.getEvent(), e.getOriginalMessage());
            return Optional.empty();
        }
        if (data == null || !data.isObject()) {
            log.warn("stream.decode_failed id={} event={} msg=payload is not an object", frame.getId(), frame.getEvent());
            return Optional.empty();
        }
        String type = frame.getEvent();
        if (type == null || type.isBlank()) {
            type = data.path("type").asText("");
        }
        return Optional.of(toEvent(parseId(frame.getId()), type, data));
    }

    private static StreamEvent toEvent(long id, String type, JsonNode data) {
        switch (type) {
            case StreamEvent.STREAM_OPEN:
                return new StreamEvent.StreamOpen(id, text(data, "session_id"), text(data, "server_time_iso"));
            case StreamEvent.MESSAGE_DELTA:
                return new StreamEvent.MessageDelta(id, data.path("role").asText("assistant"), data.path("delta").asText(""));
            case StreamEvent.MESSAGE_FINAL:
                return new StreamEvent.MessageFinal(id, text(data, "message_id"), data.path("role").asText("assistant"),
                        data.path("text").asText(""), data.path("render_hints").path("max_cards").asInt(0));
            case StreamEvent.CARD_NEXT_ACTIONS:
                return new StreamEvent.NextActionsCard(id, text(data, "schema"), data.path("items"));
            case StreamEvent.CARD_PLAN:
                return new StreamEvent.PlanCard(id, text(data, "schema"), data.path("plan"));
            case StreamEvent.CARD_WEEKLY_REVIEW:
                return new StreamEvent.WeeklyReviewCard(id, text(data, "schema"), data.path("review"));
            case StreamEvent.TOOL_REQUEST:
                String toolId = data.hasNonNull("tool_id") ? text(data, "tool_id") : text(data, "tool");
                return new StreamEvent.ToolRequest(id, text(data, "request_id"), toolId,
                        data.path("requires_confirmation").asBoolean(true), text(data, "reason"), data.path("input"));
            case StreamEvent.TOOL_STATUS:
                return new StreamEvent.ToolStatus(id, text(data, "tool_run_id"), text(data, "status"),
                        data.get("output"), text(data, "error"));
            case StreamEvent.POLICY_NOTICE:
                return new StreamEvent.PolicyNotice(id, text(data, "kind"), text(data, "message"));
            case StreamEvent.ERROR:
                return new StreamEvent.StreamError(id, text(data, "code"), text(data, "message"));
            case StreamEvent.STREAM_DONE:
                return new StreamEvent.StreamDone(id, data.path("status").asText("ok"));
            default:
                return new StreamEvent.Unknown(id, type, data);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static long parseId(String id) {
        if (id == null || id.isBlank()) {
            return 0;
        }
        try {
            return Long.parseLong(id.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
