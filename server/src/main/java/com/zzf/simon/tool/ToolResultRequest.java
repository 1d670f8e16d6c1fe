package com.zzf.simon.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ToolResultRequest {
    private String toolRunId;
    private String executionToken;
    /** Kept as text so an unknown value is a 400 with a useful message. */
    private String status;
    private JsonNode output;
    private String error;
}
