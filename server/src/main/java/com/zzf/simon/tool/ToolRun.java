package com.zzf.simon.tool;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Stored in collection {@code tool_runs}. {@code executionToken} is present only while the run is pending.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolRun {
    private String id;
    private String uid;
    private String toolId;
    private String sessionId;
    private JsonNode input;
    private JsonNode output;
    private ToolRunStatus status;
    private String executionToken;
    private String error;
    private String createdAt;
    private String updatedAt;

    /**
     * Copy safe to return to callers.
     */
    public ToolRun withoutToken() {
        return toBuilder().executionToken(null).build();
    }
}
