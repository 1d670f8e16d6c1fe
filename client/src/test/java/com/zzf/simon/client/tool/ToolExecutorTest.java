package com.zzf.simon.client.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.simon.client.SimonApiClient;
import com.zzf.simon.client.SimonApiException;
import com.zzf.simon.client.ToolResultReport;
import com.zzf.simon.client.ToolRunInfo;
import com.zzf.simon.client.ToolRunTicket;
import com.zzf.simon.client.events.CalendarEventRecord;
import com.zzf.simon.client.events.EventPersistenceService;
import com.zzf.simon.client.events.ReminderRecord;
import com.zzf.simon.client.stream.StreamEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ToolExecutorTest {
    private static final String CALENDAR_INPUT = "{\"title\":\"Focus block\",\"start_iso\":\"2026-03-02T11:00:00.000Z\","
            + "\"end_iso\":\"2026-03-02T11:30:00.000Z\",\"idempotency_key\":\"k1\"}";

    private final ObjectMapper mapper = new ObjectMapper();
    private SimonApiClient api;
    private DeviceCapabilities device;
    private EventPersistenceService persistence;

    @BeforeEach
    void setUp() {
        api = mock(SimonApiClient.class);
        device = mock(DeviceCapabilities.class);
        persistence = mock(EventPersistenceService.class);
        when(api.executeTool(any(), any(), any())).thenReturn(new ToolRunTicket("run_1", "pending", "tok_secret", null, null));
    }

    @Test
    void decline_should_report_declined_without_native_action() throws Exception {
        ToolExecutor executor = newExecutor(run -> CompletableFuture.completedFuture(Decision.DECLINE));

        ToolOutcome outcome = executor.handle(calendarRequest(), "ses_1", "coach_a").join();

        assertEquals(ToolOutcome.Kind.DECLINED, outcome.getKind());
        assertTrue(outcome.isReported());
        ToolResultReport report = capturedReport();
        assertEquals("run_1", report.getToolRunId());
        assertEquals("tok_secret", report.getExecutionToken());
        assertEquals(ToolResultReport.DECLINED, report.getStatus());
        assertNull(report.getOutput());
        verifyNoInteractions(device, persistence);
    }

    @Test
    void accepted_calendar_request_should_execute_record_and_report() throws Exception {
        when(device.requestPermission(DevicePermission.CALENDAR)).thenReturn(CompletableFuture.completedFuture(true));
        when(device.createCalendarEvent(any())).thenReturn(new NativeResult("EK-1", "saved"));
        when(persistence.saveCalendarEvent(any(), any(), any())).thenReturn(CalendarEventRecord.builder().id("k1").build());
        ToolExecutor executor = newExecutor(run -> CompletableFuture.completedFuture(Decision.ACCEPT));

        ToolOutcome outcome = executor.handle(calendarRequest(), "ses_1", "coach_a").join();

        assertEquals(ToolOutcome.Kind.EXECUTED, outcome.getKind());
        assertEquals("EK-1", outcome.getOutput().path("event_id").asText());
        assertEquals("k1", outcome.getOutput().path("record_id").asText());
        ArgumentCaptor<CalendarEventInput> input = ArgumentCaptor.forClass(CalendarEventInput.class);
        verify(device).createCalendarEvent(input.capture());
        assertEquals("Focus block", input.getValue().getTitle());
        assertEquals("k1", input.getValue().getIdempotencyKey());
        ToolResultReport report = capturedReport();
        assertEquals(ToolResultReport.EXECUTED, report.getStatus());
        assertEquals("saved", report.getOutput().path("status").asText());
    }

    @Test
    void denied_permission_should_report_failed_with_permission_denied() throws Exception {
        when(device.requestPermission(DevicePermission.REMINDERS)).thenReturn(CompletableFuture.completedFuture(false));
        ToolExecutor executor = newExecutor(run -> CompletableFuture.completedFuture(Decision.ACCEPT));

        ToolOutcome outcome = executor.handle(request("reminder_create", "{\"title\":\"Stretch\",\"idempotency_key\":\"r1\"}"),
                "ses_1", "coach_a").join();

        assertEquals(ToolOutcome.Kind.PERMISSION_DENIED, outcome.getKind());
        ToolResultReport report = capturedReport();
        assertEquals(ToolResultReport.FAILED, report.getStatus());
        assertEquals("permission_denied", report.getError());
        verify(device, never()).createReminder(any());
        verifyNoInteractions(persistence);
    }

    @Test
    void native_failure_should_report_failed_with_message() throws Exception {
        when(device.requestPermission(DevicePermission.CALENDAR)).thenReturn(CompletableFuture.completedFuture(true));
        when(device.createCalendarEvent(any())).thenThrow(new DeviceActionException("calendar is read-only"));
        ToolExecutor executor = newExecutor(run -> CompletableFuture.completedFuture(Decision.ACCEPT));

        ToolOutcome outcome = executor.handle(calendarRequest(), "ses_1", "coach_a").join();

        assertEquals(ToolOutcome.Kind.FAILED, outcome.getKind());
        assertEquals("calendar is read-only", capturedReport().getError());
        verifyNoInteractions(persistence);
    }

    @Test
    void record_write_failure_should_not_fail_the_run() throws Exception {
        when(device.requestPermission(DevicePermission.REMINDERS)).thenReturn(CompletableFuture.completedFuture(true));
        when(device.createReminder(any())).thenReturn(new NativeResult("R-9", "saved"));
        when(persistence.saveReminder(any(), any(), any())).thenThrow(SimonApiException.network("offline", null));
        ToolExecutor executor = newExecutor(run -> CompletableFuture.completedFuture(Decision.ACCEPT));

        ToolOutcome outcome = executor.handle(request("reminder_create", "{\"title\":\"Stretch\",\"idempotency_key\":\"r1\"}"),
                "ses_1", "coach_a").join();

        assertEquals(ToolOutcome.Kind.EXECUTED, outcome.getKind());
        assertEquals("R-9", outcome.getOutput().path("reminder_id").asText());
        assertFalse(outcome.getOutput().has("record_id"));
        assertEquals(ToolResultReport.EXECUTED, capturedReport().getStatus());
    }

    @Test
    void interrupted_confirmation_should_park_the_run_until_resumed() throws Exception {
        AtomicInteger asks = new AtomicInteger();
        ToolExecutor executor = newExecutor(run -> {
            if (asks.incrementAndGet() == 1) {
                CompletableFuture<Decision> dismissed = new CompletableFuture<>();
                dismissed.cancel(true);
                return dismissed;
            }
            return CompletableFuture.completedFuture(Decision.ACCEPT);
        });
        when(device.requestPermission(DevicePermission.REMINDERS)).thenReturn(CompletableFuture.completedFuture(true));
        when(device.createReminder(any())).thenReturn(new NativeResult("R-1", "saved"));
        when(persistence.saveReminder(any(), any(), any())).thenReturn(ReminderRecord.builder().id("r1").build());

        ToolOutcome first = executor.handle(request("reminder_create", "{\"title\":\"Stretch\",\"idempotency_key\":\"r1\"}"),
                "ses_1", "coach_a").join();

        assertEquals(ToolOutcome.Kind.PENDING, first.getKind());
        assertEquals(1, executor.pendingRuns().size());
        assertEquals("tok_secret", executor.pendingRuns().get(0).getExecutionToken());
        verify(api, never()).submitToolResult(any());
        when(api.getToolRun("run_1")).thenReturn(runInfo("run_1", "pending"));

        ToolOutcome resumed = executor.resume("run_1").join();

        assertEquals(ToolOutcome.Kind.EXECUTED, resumed.getKind());
        assertTrue(executor.pendingRuns().isEmpty());
        assertEquals("tok_secret", capturedReport().getExecutionToken());
        verify(api, times(1)).executeTool(any(), any(), any());
    }

    @Test
    void resume_should_skip_a_run_the_server_already_closed() throws Exception {
        ToolExecutor executor = newExecutor(run -> {
            CompletableFuture<Decision> dismissed = new CompletableFuture<>();
            dismissed.cancel(true);
            return dismissed;
        });
        executor.handle(request("reminder_create", "{\"title\":\"Stretch\",\"idempotency_key\":\"r1\"}"),
                "ses_1", "coach_a").join();
        ToolRunInfo declined = runInfo("run_1", "declined");
        when(api.getToolRun("run_1")).thenReturn(declined);

        ToolOutcome resumed = executor.resume("run_1").join();

        assertEquals(ToolOutcome.Kind.ALREADY_TERMINAL, resumed.getKind());
        assertTrue(executor.pendingRuns().isEmpty());
        verify(api).getToolRun("run_1");
        verify(api, never()).submitToolResult(any());
        verifyNoInteractions(device, persistence);
    }

    @Test
    void resume_should_accept_a_run_kept_across_restart() throws Exception {
        when(device.requestPermission(DevicePermission.REMINDERS)).thenReturn(CompletableFuture.completedFuture(true));
        when(device.createReminder(any())).thenReturn(new NativeResult("R-2", "saved"));
        when(persistence.saveReminder(any(), any(), any())).thenReturn(ReminderRecord.builder().id("r2").build());
        when(api.getToolRun("run_7")).thenReturn(runInfo("run_7", "pending"));
        PendingToolRun saved = PendingToolRun.builder()
                .toolRunId("run_7")
                .executionToken("tok_kept")
                .toolId("reminder_create")
                .input(mapper.readTree("{\"title\":\"Walk\",\"idempotency_key\":\"r2\"}"))
                .sessionId("ses_1")
                .coachId("coach_a")
                .requiresConfirmation(true)
                .build();
        ToolExecutor fresh = newExecutor(run -> CompletableFuture.completedFuture(Decision.ACCEPT));

        ToolOutcome resumed = fresh.resume(saved).join();

        assertEquals(ToolOutcome.Kind.EXECUTED, resumed.getKind());
        ToolResultReport report = capturedReport();
        assertEquals("run_7", report.getToolRunId());
        assertEquals("tok_kept", report.getExecutionToken());
        verify(api, never()).executeTool(any(), any(), any());
    }

    @Test
    void resume_should_keep_the_run_parked_when_the_status_check_fails() throws Exception {
        ToolExecutor executor = newExecutor(run -> {
            CompletableFuture<Decision> dismissed = new CompletableFuture<>();
            dismissed.cancel(true);
            return dismissed;
        });
        executor.handle(calendarRequest(), "ses_1", "coach_a").join();
        when(api.getToolRun("run_1")).thenThrow(SimonApiException.network("offline", null));

        ToolOutcome resumed = executor.resume("run_1").join();

        assertEquals(ToolOutcome.Kind.PENDING, resumed.getKind());
        assertEquals(1, executor.pendingRuns().size());
        verifyNoInteractions(device);
    }

    @Test
    void server_owned_tool_should_return_without_confirmation_or_report() {
        when(api.executeTool(eq("memory_read"), any(), any()))
                .thenReturn(new ToolRunTicket("run_2", "executed", null, mapper.createObjectNode().put("count", 0), null));
        ToolConfirmation confirmation = mock(ToolConfirmation.class);
        ToolExecutor executor = new ToolExecutor(api, device, persistence, confirmation, mapper, Runnable::run, Duration.ZERO);

        ToolOutcome outcome = executor.handle(request("memory_read", "{}"), "ses_1", "coach_a").join();

        assertEquals(ToolOutcome.Kind.EXECUTED, outcome.getKind());
        assertEquals(0, outcome.getOutput().path("count").asInt(-1));
        verifyNoInteractions(confirmation, device);
        verify(api, never()).submitToolResult(any());
    }

    @Test
    void conflict_on_resent_report_should_count_as_recorded() throws Exception {
        doThrow(SimonApiException.network("reset", null))
                .doThrow(SimonApiException.fromStatus(409, "TOOL_RUN_TERMINAL", "already terminal", null))
                .when(api).submitToolResult(any());
        ToolExecutor executor = newExecutor(run -> CompletableFuture.completedFuture(Decision.DECLINE));

        ToolOutcome outcome = executor.handle(calendarRequest(), "ses_1", "coach_a").join();

        assertEquals(ToolOutcome.Kind.DECLINED, outcome.getKind());
        assertTrue(outcome.isReported());
        verify(api, times(2)).submitToolResult(any());
    }

    private ToolExecutor newExecutor(ToolConfirmation confirmation) {
        return new ToolExecutor(api, device, persistence, confirmation, mapper, Runnable::run, Duration.ZERO);
    }

    private StreamEvent.ToolRequest calendarRequest() throws Exception {
        return request("calendar_event_create", CALENDAR_INPUT);
    }

    private StreamEvent.ToolRequest request(String toolId, String inputJson) {
        try {
            JsonNode input = mapper.readTree(inputJson);
            return new StreamEvent.ToolRequest(5, "req_1", toolId, true, "Protect the time", input);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static ToolRunInfo runInfo(String id, String status) {
        ToolRunInfo info = new ToolRunInfo();
        info.setId(id);
        info.setStatus(status);
        return info;
    }

    private ToolResultReport capturedReport() {
        ArgumentCaptor<ToolResultReport> captor = ArgumentCaptor.forClass(ToolResultReport.class);
        verify(api).submitToolResult(captor.capture());
        return captor.getValue();
    }
}
