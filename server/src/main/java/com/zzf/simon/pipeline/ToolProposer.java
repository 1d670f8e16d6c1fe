package com.zzf.simon.pipeline;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.simon.envelope.Payloads;
import com.zzf.simon.id.Identifier;
import com.zzf.simon.id.Timestamps;
import com.zzf.simon.tool.ToolDefinition;
import com.zzf.simon.tool.ToolRegistry;
import com.zzf.simon.util.ModelOutput;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns keywords in the final reply into {@code tool.request} payloads. Inputs are prefilled so they pass
 * schema validation as-is; the user can still edit them before confirming.
 */
@Component
public class ToolProposer {
    static final String CALENDAR = "calendar_event_create";
    static final String REMINDER = "reminder_create";
    static final String NOTIFICATION = "local_notification_schedule";
    private static final int TITLE_MAX = 120;
    private static final long NOTIFICATION_DELAY_SEC = 3600;

    private final ToolRegistry registry;
    private final Clock clock;

    @Autowired
    public ToolProposer(ToolRegistry registry) {
        this(registry, Clock.systemUTC());
    }

    ToolProposer(ToolRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    public List<ObjectNode> propose(String finalText, String userMessage, CoachBlueprint blueprint) {
        String lower = finalText == null ? "" : finalText.toLowerCase(Locale.ROOT);
        String title = titleFrom(userMessage);
        List<ObjectNode> out = new ArrayList<>();
        if (lower.contains("calendar") || lower.contains("schedule")) {
            request(CALENDAR, "Schedule the discussed action", calendarInput(title), blueprint).ifPresent(out::add);
        }
        if (lower.contains("remind")) {
            request(REMINDER, "Create a reminder for this action", reminderInput(title), blueprint).ifPresent(out::add);
        }
        if (lower.contains("notify") || lower.contains("nudge me")) {
            request(NOTIFICATION, "Nudge you about this later", notificationInput(title), blueprint).ifPresent(out::add);
        }
        return out;
    }

    private Optional<ObjectNode> request(String toolId, String reason, ObjectNode input, CoachBlueprint blueprint) {
        if (!blueprint.allowsTool(toolId)) {
            return Optional.empty();
        }
        Optional<ToolDefinition> tool = registry.find(toolId);
        if (tool.isEmpty()) {
            return Optional.empty();
        }
        String requestId = Identifier.random("tr");
        input.put("idempotency_key", requestId);
        boolean confirm = tool.get().isRequiresConfirmation() || blueprint.requiresConfirmation(toolId);
        return Optional.of(Payloads.toolRequest(requestId, toolId, confirm, reason, input));
    }

    private ObjectNode calendarInput(String title) {
        Instant start = clock.instant().truncatedTo(ChronoUnit.HOURS).plus(Duration.ofHours(2));
        ObjectNode input = JsonNodeFactory.instance.objectNode();
        input.put("title", title);
        input.put("start_iso", Timestamps.format(start));
        input.put("end_iso", Timestamps.format(start.plus(Duration.ofMinutes(30))));
        return input;
    }

    private static ObjectNode reminderInput(String title) {
        ObjectNode input = JsonNodeFactory.instance.objectNode();
        input.put("title", title);
        return input;
    }

    private static ObjectNode notificationInput(String title) {
        ObjectNode input = JsonNodeFactory.instance.objectNode();
        input.put("title", title);
        input.put("body", "Time for your next step");
        input.putObject("trigger").put("kind", "after_delay").put("delay_sec", NOTIFICATION_DELAY_SEC);
        return input;
    }

    static String titleFrom(String userMessage) {
        String t = userMessage == null ? "" : userMessage.trim().replaceAll("\\s+", " ");
        return t.isEmpty() ? "Next step" : ModelOutput.truncate(t, TITLE_MAX);
    }
}
