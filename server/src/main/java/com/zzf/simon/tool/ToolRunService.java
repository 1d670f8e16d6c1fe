package com.zzf.simon.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.simon.api.ApiException;
import com.zzf.simon.id.Identifier;
import com.zzf.simon.id.Timestamps;
import com.zzf.simon.session.SessionService;
import com.zzf.simon.store.DocumentStore;
import com.zzf.simon.tool.server.ServerToolExecutor;
import com.zzf.simon.tool.server.ServerToolResult;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Request and report halves of the tool handshake. Confirmation happens on the device and never reaches
 * this service.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ToolRunService {
    static final String COLLECTION = "tool_runs";

    private final ToolRegistry registry;
    private final SchemaValidator validator;
    private final EntitlementService entitlements;
    private final ToolRateLimiter rateLimiter;
    private final SessionService sessionService;
    private final ServerToolExecutor serverTools;
    private final DocumentStore store;
    private final MeterRegistry meterRegistry;

    public ExecuteToolResponse execute(String uid, ExecuteToolRequest request) {
        if (request == null || isBlank(request.getToolId())) {
            throw ApiException.validation("INVALID_REQUEST", "tool_id is required");
        }
        if (request.getInput() == null || !request.getInput().isObject()) {
            throw ApiException.validation("INVALID_REQUEST", "input must be an object");
        }
        ToolDefinition tool = registry.find(request.getToolId())
                .orElseThrow(() -> ApiException.notFound("TOOL_NOT_FOUND", "unknown tool: " + request.getToolId()));
        List<String> violations = validator.validate(tool.getSchema(), request.getInput());
        if (!violations.isEmpty()) {
            throw ApiException.validation("INVALID_INPUT", "input does not match schema: " + String.join("; ", violations));
        }
        if (!entitlements.isEntitled(uid, tool.getId())) {
            throw ApiException.forbidden("ENTITLEMENT_REQUIRED", "tool " + tool.getId() + " requires a pro subscription");
        }
        long retryAfter = rateLimiter.acquire(uid, tool.getId());
        if (retryAfter > 0) {
            log.info("tool.rate_limited uid={} tool={} retryAfter={}", uid, tool.getId(), retryAfter);
            throw ApiException.rateLimited("too many " + tool.getId() + " calls", retryAfter);
        }
        String sessionId = isBlank(request.getSessionId()) ? null : request.getSessionId();
        if (sessionId != null) {
            sessionService.requireOwned(uid, sessionId);
        }

        String now = Timestamps.now();
        ToolRun run = ToolRun.builder()
                .id(Identifier.random("toolrun"))
                .uid(uid)
                .toolId(tool.getId())
                .sessionId(sessionId)
                .input(request.getInput())
                .createdAt(now)
                .updatedAt(now)
                .build();

        switch (tool.getOwner()) {
            case SERVER: {
                ServerToolResult result = serverTools.execute(uid, tool.getId(), request.getInput());
                run.setStatus(result.isExecuted() ? ToolRunStatus.EXECUTED : ToolRunStatus.FAILED);
                run.setOutput(result.getOutput());
                run.setError(result.getError());
                store.put(COLLECTION, run.getId(), run);
                count(tool.getId(), run.getStatus());
                log.info("tool.execute tool={} run={} owner=server status={}", tool.getId(), run.getId(), run.getStatus().wire());
                return ExecuteToolResponse.builder()
                        .toolRunId(run.getId())
                        .status(run.getStatus())
                        .output(run.getOutput())
                        .error(run.getError())
                        .build();
            }
            case CLIENT: {
                run.setStatus(ToolRunStatus.PENDING);
                run.setExecutionToken(ExecutionTokens.generate());
                store.put(COLLECTION, run.getId(), run);
                count(tool.getId(), run.getStatus());
                log.info("tool.execute tool={} run={} owner=client status=pending", tool.getId(), run.getId());
                return ExecuteToolResponse.builder()
                        .toolRunId(run.getId())
                        .status(ToolRunStatus.PENDING)
                        .executionToken(run.getExecutionToken())
                        .build();
            }
            default:
                throw new IllegalStateException("Unhandled tool owner " + tool.getOwner());
        }
    }

    /**
     * Moves a pending run to its terminal status. The check and the write happen in one atomic update so
     * concurrent reports cannot both succeed.
     */
    public ToolRun report(String uid, ToolResultRequest request) {
        if (request == null || isBlank(request.getToolRunId())) {
            throw ApiException.validation("INVALID_REQUEST", "tool_run_id is required");
        }
        if (isBlank(request.getExecutionToken())) {
            throw ApiException.validation("INVALID_REQUEST", "execution_token is required");
        }
        ToolRunStatus status = ToolRunStatus.fromWire(request.getStatus());
        if (status == null || !status.isTerminal()) {
            throw ApiException.validation("INVALID_STATUS", "status must be executed, failed or declined");
        }

        ToolRun updated = store.update(COLLECTION, request.getToolRunId(), ToolRun.class, run -> {
            if (!uid.equals(run.getUid())) {
                throw ApiException.forbidden("ACCESS_DENIED", "access denied");
            }
            if (run.getStatus() != ToolRunStatus.PENDING) {
                throw ApiException.conflict("TOOL_RUN_TERMINAL", "tool run already " + run.getStatus().wire());
            }
            if (!ExecutionTokens.matches(run.getExecutionToken(), request.getExecutionToken())) {
                throw ApiException.forbidden("INVALID_TOKEN", "invalid execution token");
            }
            run.setStatus(status);
            run.setOutput(status == ToolRunStatus.DECLINED ? null : request.getOutput());
            run.setError(request.getError());
            run.setExecutionToken(null);
            run.setUpdatedAt(Timestamps.now());
            return run;
        }).orElseThrow(() -> ApiException.notFound("TOOL_RUN_NOT_FOUND", "tool run not found"));

        count(updated.getToolId(), status);
        log.info("tool.result tool={} run={} status={}", updated.getToolId(), updated.getId(), status.wire());
        return updated;
    }

    public ToolRun get(String uid, String runId) {
        ToolRun run = store.get(COLLECTION, runId, ToolRun.class)
                .orElseThrow(() -> ApiException.notFound("TOOL_RUN_NOT_FOUND", "tool run not found"));
        if (!uid.equals(run.getUid())) {
            throw ApiException.forbidden("ACCESS_DENIED", "access denied");
        }
        return run.withoutToken();
    }

    private void count(String toolId, ToolRunStatus status) {
        meterRegistry.counter("simon.tool.runs", "tool", toolId, "status", status.wire()).increment();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
