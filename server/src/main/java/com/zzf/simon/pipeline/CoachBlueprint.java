package com.zzf.simon.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Behavioral definition of a coach, stored in collection {@code coaches}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CoachBlueprint {
    public static final String DEFAULT_ID = "default";

    private String id;
    @Builder.Default
    private Identity identity = new Identity();
    @Builder.Default
    private Style style = new Style();
    @Builder.Default
    private InteractionRules interactionRules = new InteractionRules();
    @Builder.Default
    private Refusals refusals = new Refusals();
    @Builder.Default
    private ToolsAllowed tools = new ToolsAllowed();

    public boolean allowsTool(String toolId) {
        return tools.getClientTools().contains(toolId) || tools.getServerTools().contains(toolId);
    }

    public boolean requiresConfirmation(String toolId) {
        return tools.getRequiresConfirmation().contains(toolId);
    }

    /**
     * Used when a session has no coach or its coach document is gone.
     */
    public static CoachBlueprint defaultBlueprint() {
        List<String> clientTools = List.of("local_notification_schedule", "calendar_event_create", "reminder_create");
        return CoachBlueprint.builder()
                .id(DEFAULT_ID)
                .identity(new Identity("General Systems Coach", "Small steps, steady systems", "productivity"))
                .style(new Style("calm", "concise", 5))
                .interactionRules(new InteractionRules(true, true))
                .refusals(new Refusals(true, true))
                .tools(new ToolsAllowed(new ArrayList<>(clientTools), new ArrayList<>(), new ArrayList<>(clientTools)))
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Identity {
        private String name = "Coach";
        private String tagline;
        private String niche;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Style {
        private String tone = "calm";
        private String verbosity = "concise";
        private int maxBullets = 5;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class InteractionRules {
        private boolean askOneQuestionAtATime;
        private boolean confirmBeforeScheduling;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Refusals {
        private boolean medical;
        private boolean legal;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ToolsAllowed {
        private List<String> clientTools = new ArrayList<>();
        private List<String> serverTools = new ArrayList<>();
        private List<String> requiresConfirmation = new ArrayList<>();
    }
}
