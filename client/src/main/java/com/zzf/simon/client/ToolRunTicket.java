package com.zzf.simon.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer to {@code POST /v1/tools/execute}. A pending ticket carries the execution token the result
 * report must echo; server-owned tools come back already terminal with their output.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolRunTicket {
    public static final String STATUS_PENDING = "pending";

    private String toolRunId;
    private String status;
    private String executionToken;
    private JsonNode output;
    private String error;

    public boolean isPending() {
        return STATUS_PENDING.equals(status);
    }
}
