package com.zzf.simon.tool.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs server-owned tools for the authenticated caller. Input has already passed schema validation;
 * any {@code uid} field in it is ignored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ServerToolExecutor {
    private final MemoryService memoryService;
    private final PlanService planService;
    private final CheckinService checkinService;
    private final ObjectMapper objectMapper;

    public ServerToolResult execute(String uid, String toolId, JsonNode input) {
        try {
            return ServerToolResult.executed(dispatch(uid, toolId, input));
        } catch (ToolFailure e) {
            log.info("tool.server.failed tool={} uid={} reason={}", toolId, uid, e.getMessage());
            return ServerToolResult.failed(e.getMessage());
        }
    }

    private JsonNode dispatch(String uid, String toolId, JsonNode input) {
        switch (toolId) {
            case "memory_read":
                return memoryService.read(uid, input.path("query").asText(), input.path("limit").asInt(0));
            case "memory_write":
                return memoryService.write(uid, input.path("patch"));
            case "plan_create":
                return planService.create(uid, input.path("coach_id").asText(null), input.path("plan"));
            case "plan_update":
                return planService.update(uid, input.path("plan_id").asText(), input.path("updates"));
            case "plan_list_active":
                return planService.listActiveOutput(uid, input.path("limit").asInt(0));
            case "checkin_schedule":
                return checkinService.schedule(uid, input.path("coach_id").asText(null),
                        cadence(input.path("cadence")), input.path("channel").asText());
            default:
                throw new IllegalArgumentException("No server implementation for tool " + toolId);
        }
    }

    private Checkin.Cadence cadence(JsonNode node) {
        try {
            return objectMapper.treeToValue(node, Checkin.Cadence.class);
        } catch (JsonProcessingException e) {
            throw new ToolFailure("invalid cadence: " + e.getOriginalMessage());
        }
    }
}
