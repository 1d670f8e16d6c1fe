package com.zzf.simon.client.tool;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/**
 * A client-owned run the server has authorized but the user has not yet confirmed. Holding the token
 * is what lets a later {@link ToolExecutor#resume(String)} finish the report.
 */
@Value
@Builder
public class PendingToolRun {
    String toolRunId;
    String executionToken;
    String toolId;
    JsonNode input;
    String sessionId;
    String coachId;
    boolean requiresConfirmation;
    String reason;
}
