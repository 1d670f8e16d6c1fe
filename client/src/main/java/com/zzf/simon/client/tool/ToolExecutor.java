package com.zzf.simon.client.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.simon.client.SimonApiClient;
import com.zzf.simon.client.SimonApiException;
import com.zzf.simon.client.ToolResultReport;
import com.zzf.simon.client.ToolRunInfo;
import com.zzf.simon.client.ToolRunTicket;
import com.zzf.simon.client.events.EventPersistenceService;
import com.zzf.simon.client.events.RecordContext;
import com.zzf.simon.client.stream.StreamEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Client half of the tool handshake: request a run from the server, ask the user, perform the native
 * action, write the side-effect record and report the outcome with the run's execution token.
 */
@Slf4j
public class ToolExecutor {
    public static final String NOTIFICATION_TOOL = "local_notification_schedule";
    public static final String CALENDAR_TOOL = "calendar_event_create";
    public static final String REMINDER_TOOL = "reminder_create";
    public static final String EXPORT_TOOL = "share_sheet_export";
    public static final String PERMISSION_DENIED = "permission_denied";
    private static final int REPORT_ATTEMPTS = 3;

    private final SimonApiClient api;
    private final DeviceCapabilities device;
    private final EventPersistenceService persistence;
    private final ToolConfirmation confirmation;
    private final ObjectMapper mapper;
    private final Executor executor;
    private final Duration reportRetryDelay;
    private final Map<String, PendingToolRun> pending = new ConcurrentHashMap<>();

    public ToolExecutor(SimonApiClient api,
                        DeviceCapabilities device,
                        EventPersistenceService persistence,
                        ToolConfirmation confirmation,
                        ObjectMapper mapper,
                        Executor executor) {
        this(api, device, persistence, confirmation, mapper, executor, Duration.ofSeconds(1));
    }

    ToolExecutor(SimonApiClient api,
                 DeviceCapabilities device,
                 EventPersistenceService persistence,
                 ToolConfirmation confirmation,
                 ObjectMapper mapper,
                 Executor executor,
                 Duration reportRetryDelay) {
        this.api = api;
        this.device = device;
        this.persistence = persistence;
        this.confirmation = confirmation;
        this.mapper = mapper;
        this.executor = executor;
        this.reportRetryDelay = reportRetryDelay;
    }

    /**
     * Runs the whole handshake for a {@code tool.request}. Server rejections of the request itself
     * (validation, entitlement, rate limit) complete the future exceptionally with {@link SimonApiException}.
     */
    public CompletableFuture<ToolOutcome> handle(StreamEvent.ToolRequest request, String sessionId, String coachId) {
        return CompletableFuture.supplyAsync(() -> {
            ToolRunTicket ticket = api.executeTool(request.getToolId(), sessionId, request.getInput());
            if (!ticket.isPending()) {
                log.info("tool.server_owned tool={} run={} status={}", request.getToolId(), ticket.getToolRunId(), ticket.getStatus());
                ToolOutcome.Kind kind = ToolResultReport.EXECUTED.equals(ticket.getStatus())
                        ? ToolOutcome.Kind.EXECUTED : ToolOutcome.Kind.FAILED;
                return new ToolOutcome(kind, ticket.getToolRunId(), ticket.getOutput(), ticket.getError(), true);
            }
            PendingToolRun run = PendingToolRun.builder()
                    .toolRunId(ticket.getToolRunId())
                    .executionToken(ticket.getExecutionToken())
                    .toolId(request.getToolId())
                    .input(request.getInput())
                    .sessionId(sessionId)
                    .coachId(coachId)
                    .requiresConfirmation(request.isRequiresConfirmation())
                    .reason(request.getReason())
                    .build();
            log.info("tool.authorized tool={} run={}", run.getToolId(), run.getToolRunId());
            return confirmAndRun(run);
        }, executor);
    }

    /**
     * Picks up a run whose confirmation was interrupted, asking the user again once the server confirms
     * the run is still pending.
     */
    public CompletableFuture<ToolOutcome> resume(String toolRunId) {
        PendingToolRun run = pending.remove(toolRunId);
        if (run == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("no pending tool run " + toolRunId));
        }
        return resumeAsync(run);
    }

    /**
     * Resumes a run the caller kept across a restart of the app. The run replaces any parked copy.
     */
    public CompletableFuture<ToolOutcome> resume(PendingToolRun run) {
        pending.remove(run.getToolRunId());
        return resumeAsync(run);
    }

    private CompletableFuture<ToolOutcome> resumeAsync(PendingToolRun run) {
        log.info("tool.resume tool={} run={}", run.getToolId(), run.getToolRunId());
        return CompletableFuture.supplyAsync(() -> {
            ToolRunInfo info;
            try {
                info = api.getToolRun(run.getToolRunId());
            } catch (SimonApiException e) {
                if (e.isTransient()) {
                    return park(run, "status check failed: " + e.getMessage());
                }
                throw e;
            }
            if (!info.isPending()) {
                log.info("tool.resume_skipped tool={} run={} status={}", run.getToolId(), run.getToolRunId(), info.getStatus());
                return ToolOutcome.alreadyTerminal(run.getToolRunId(), info);
            }
            return confirmAndRun(run);
        }, executor);
    }

    public List<PendingToolRun> pendingRuns() {
        return new ArrayList<>(pending.values());
    }

    private ToolOutcome confirmAndRun(PendingToolRun run) {
        Decision decision;
        try {
            decision = run.isRequiresConfirmation() ? confirmation.confirm(run).join() : Decision.ACCEPT;
        } catch (CancellationException | CompletionException e) {
            return park(run, "confirmation interrupted");
        }
        if (decision != Decision.ACCEPT) {
            log.info("tool.declined tool={} run={}", run.getToolId(), run.getToolRunId());
            boolean reported = report(run, ToolResultReport.DECLINED, null, null);
            return new ToolOutcome(ToolOutcome.Kind.DECLINED, run.getToolRunId(), null, null, reported);
        }
        try {
            JsonNode output = runNative(run);
            boolean reported = report(run, ToolResultReport.EXECUTED, output, null);
            return new ToolOutcome(ToolOutcome.Kind.EXECUTED, run.getToolRunId(), output, null, reported);
        } catch (PromptInterruptedException e) {
            return park(run, "permission prompt interrupted");
        } catch (PermissionDeniedException e) {
            log.info("tool.permission_denied tool={} run={} permission={}", run.getToolId(), run.getToolRunId(), e.getMessage());
            boolean reported = report(run, ToolResultReport.FAILED, null, PERMISSION_DENIED);
            return new ToolOutcome(ToolOutcome.Kind.PERMISSION_DENIED, run.getToolRunId(), null, PERMISSION_DENIED, reported);
        } catch (JsonProcessingException e) {
            return fail(run, "invalid input: " + e.getOriginalMessage());
        } catch (DeviceActionException e) {
            return fail(run, e.getMessage());
        }
    }

    private JsonNode runNative(PendingToolRun run)
            throws JsonProcessingException, DeviceActionException, PermissionDeniedException, PromptInterruptedException {
        RecordContext context = new RecordContext(run.getCoachId(), run.getSessionId(), run.getToolRunId());
        switch (run.getToolId()) {
            case NOTIFICATION_TOOL: {
                NotificationInput input = mapper.treeToValue(run.getInput(), NotificationInput.class);
                requirePermission(DevicePermission.NOTIFICATIONS);
                NativeResult result = device.scheduleNotification(input);
                String recordId = persist(run, () -> persistence.saveNotification(context, input, result).getId());
                return output("scheduled_id", result, recordId);
            }
            case CALENDAR_TOOL: {
                CalendarEventInput input = mapper.treeToValue(run.getInput(), CalendarEventInput.class);
                requirePermission(DevicePermission.CALENDAR);
                NativeResult result = device.createCalendarEvent(input);
                String recordId = persist(run, () -> persistence.saveCalendarEvent(context, input, result).getId());
                return output("event_id", result, recordId);
            }
            case REMINDER_TOOL: {
                ReminderInput input = mapper.treeToValue(run.getInput(), ReminderInput.class);
                requirePermission(DevicePermission.REMINDERS);
                NativeResult result = device.createReminder(input);
                String recordId = persist(run, () -> persistence.saveReminder(context, input, result).getId());
                return output("reminder_id", result, recordId);
            }
            case EXPORT_TOOL: {
                ExportInput input = mapper.treeToValue(run.getInput(), ExportInput.class);
                device.export(input);
                ObjectNode output = mapper.createObjectNode();
                output.put("status", "exported");
                return output;
            }
            default:
                throw new DeviceActionException("unsupported tool: " + run.getToolId());
        }
    }

    private void requirePermission(DevicePermission permission) throws PermissionDeniedException, PromptInterruptedException {
        Boolean granted;
        try {
            granted = device.requestPermission(permission).join();
        } catch (CancellationException e) {
            throw new PromptInterruptedException();
        } catch (CompletionException e) {
            log.warn("tool.permission_failed permission={} msg={}", permission, e.getMessage());
            granted = Boolean.FALSE;
        }
        if (!Boolean.TRUE.equals(granted)) {
            throw new PermissionDeniedException(permission.name());
        }
    }

    // The native action already happened; a missing record must not turn it into a failure.
    private String persist(PendingToolRun run, Supplier<String> write) {
        try {
            return write.get();
        } catch (RuntimeException e) {
            log.warn("tool.record_failed tool={} run={} msg={}", run.getToolId(), run.getToolRunId(), e.getMessage());
            return null;
        }
    }

    private ObjectNode output(String idField, NativeResult result, String recordId) {
        ObjectNode output = mapper.createObjectNode();
        output.put(idField, result.getNativeId());
        output.put("status", result.getNativeStatus());
        if (recordId != null) {
            output.put("record_id", recordId);
        }
        return output;
    }

    private ToolOutcome fail(PendingToolRun run, String error) {
        log.warn("tool.failed tool={} run={} error={}", run.getToolId(), run.getToolRunId(), error);
        boolean reported = report(run, ToolResultReport.FAILED, null, error);
        return new ToolOutcome(ToolOutcome.Kind.FAILED, run.getToolRunId(), null, error, reported);
    }

    private ToolOutcome park(PendingToolRun run, String why) {
        pending.put(run.getToolRunId(), run);
        log.info("tool.parked tool={} run={} reason={}", run.getToolId(), run.getToolRunId(), why);
        return ToolOutcome.pending(run.getToolRunId());
    }

    /**
     * Sends the result, resending the identical report on transient failures. A 409 on a resend means an
     * earlier attempt reached the server.
     */
    private boolean report(PendingToolRun run, String status, JsonNode output, String error) {
        ToolResultReport report = ToolResultReport.builder()
                .toolRunId(run.getToolRunId())
                .executionToken(run.getExecutionToken())
                .status(status)
                .output(output)
                .error(error)
                .build();
        for (int attempt = 1; attempt <= REPORT_ATTEMPTS; attempt++) {
            try {
                api.submitToolResult(report);
                log.info("tool.reported tool={} run={} status={}", run.getToolId(), run.getToolRunId(), status);
                return true;
            } catch (SimonApiException e) {
                if (attempt > 1 && e.getKind() == SimonApiException.Kind.CONFLICT) {
                    log.info("tool.report_already_recorded run={}", run.getToolRunId());
                    return true;
                }
                if (!e.isTransient() || attempt == REPORT_ATTEMPTS) {
                    log.error("tool.report_failed run={} status={} code={} msg={}", run.getToolRunId(), status, e.getCode(), e.getMessage());
                    return false;
                }
                log.warn("tool.report_retry run={} attempt={}/{} msg={}", run.getToolRunId(), attempt, REPORT_ATTEMPTS, e.getMessage());
                try {
                    Thread.sleep(reportRetryDelay.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return false;
    }

    private static final class PermissionDeniedException extends Exception {
        PermissionDeniedException(String permission) {
            super(permission);
        }
    }

    private static final class PromptInterruptedException extends Exception {
    }
}
