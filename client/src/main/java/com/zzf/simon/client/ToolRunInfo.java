package com.zzf.simon.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * Server view of a tool run. The execution token is never included.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolRunInfo {
    private String id;
    private String toolId;
    private String sessionId;
    private JsonNode input;
    private JsonNode output;
    private String status;
    private String error;
    private String createdAt;
    private String updatedAt;

    public boolean isPending() {
        return ToolRunTicket.STATUS_PENDING.equals(status);
    }
}
