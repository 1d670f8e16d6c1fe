package com.zzf.simon.pipeline;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.simon.session.Message;
import com.zzf.simon.tool.server.UserMemory;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link CoachContext} into model messages.
 */
final class PromptBuilder {

    private PromptBuilder() {
    }

    static List<ChatMessage> messages(CoachContext context, String userMessage) {
        List<ChatMessage> out = new ArrayList<>();
        out.add(SystemMessage.from(systemPrompt(context)));
        for (Message m : context.getHistory()) {
            if (m.getContentText() == null || m.getContentText().isBlank()) {
                continue;
            }
            if (Message.ROLE_ASSISTANT.equals(m.getRole())) {
                out.add(AiMessage.from(m.getContentText()));
            } else {
                out.add(UserMessage.from(m.getContentText()));
            }
        }
        out.add(UserMessage.from(userMessage));
        return out;
    }

    static String systemPrompt(CoachContext context) {
        CoachBlueprint bp = context.getBlueprint();
        StringBuilder sb = new StringBuilder();
        sb.append("You are ").append(bp.getIdentity().getName());
        if (bp.getIdentity().getNiche() != null) {
            sb.append(", a ").append(bp.getIdentity().getNiche()).append(" coach");
        }
        sb.append(". You are minimalist: short answers, one concrete next step.\n");
        if (bp.getIdentity().getTagline() != null) {
            sb.append("Tagline: ").append(bp.getIdentity().getTagline()).append("\n");
        }

        sb.append("\nStyle:\n");
        sb.append("- Tone: ").append(bp.getStyle().getTone()).append("\n");
        sb.append("- Verbosity: ").append(bp.getStyle().getVerbosity()).append("\n");
        sb.append("- At most ").append(bp.getStyle().getMaxBullets()).append(" bullets\n");
        if (bp.getInteractionRules().isAskOneQuestionAtATime()) {
            sb.append("- Ask one question at a time\n");
        }
        if (bp.getInteractionRules().isConfirmBeforeScheduling()) {
            sb.append("- Confirm before scheduling anything\n");
        }

        sb.append("\nSafety:\n");
        if (bp.getRefusals().isMedical()) {
            sb.append("- Never give medical advice\n");
        }
        if (bp.getRefusals().isLegal()) {
            sb.append("- Never give legal advice\n");
        }
        sb.append("- Never ask for passwords, card numbers or other secrets\n");

        if (!context.getActivePlans().isEmpty()) {
            sb.append("\nActive plans:\n");
            for (ObjectNode plan : context.getActivePlans()) {
                sb.append("- ").append(plan.path("title").asText("untitled"));
                String objective = plan.path("objective").asText("");
                if (!objective.isBlank()) {
                    sb.append(": ").append(objective);
                }
                sb.append("\n");
            }
        }
        UserMemory memory = context.getMemory();
        if (memory != null && !memory.getCommitments().isEmpty()) {
            sb.append("\nCommitments:\n");
            memory.getCommitments().stream()
                    .filter(c -> "active".equals(c.getStatus()))
                    .forEach(c -> sb.append("- ").append(c.getText()).append("\n"));
        }
        if (memory != null && !memory.getPreferences().isEmpty()) {
            sb.append("\nPreferences:\n");
            memory.getPreferences().forEach((k, v) -> sb.append("- ").append(k).append(": ")
                    .append(v.isTextual() ? v.asText() : v.toString()).append("\n"));
        }
        return sb.toString();
    }
}
