package com.zzf.simon.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolResultReport {
    public static final String EXECUTED = "executed";
    public static final String FAILED = "failed";
    public static final String DECLINED = "declined";

    String toolRunId;
    String executionToken;
    String status;
    JsonNode output;
    String error;
}
