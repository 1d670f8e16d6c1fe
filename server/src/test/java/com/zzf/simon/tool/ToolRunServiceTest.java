package com.zzf.simon.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.simon.api.ApiException;
import com.zzf.simon.api.ErrorKind;
import com.zzf.simon.config.SimonProperties;
import com.zzf.simon.session.Session;
import com.zzf.simon.session.SessionService;
import com.zzf.simon.store.InMemoryDocumentStore;
import com.zzf.simon.tool.server.CheckinService;
import com.zzf.simon.tool.server.MemoryService;
import com.zzf.simon.tool.server.PlanService;
import com.zzf.simon.tool.server.ServerToolExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ToolRunServiceTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private InMemoryDocumentStore store;
    private SessionService sessions;
    private SimonProperties properties;
    private ToolRunService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore(mapper);
        sessions = new SessionService(store);
        properties = new SimonProperties();
        properties.getTools().getEntitlements().getProOnly().add("share_sheet_export");
        service = newService();
    }

    private ExecuteToolRequest reminder(String key) {
        ObjectNode input = mapper.createObjectNode().put("title", "Stretch").put("idempotency_key", key);
        return new ExecuteToolRequest("reminder_create", null, input);
    }

    private ToolResultRequest result(String runId, String token, String status) {
        return new ToolResultRequest(runId, token, status, mapper.createObjectNode().put("reminder_id", "r1"), null);
    }

    @Test
    void shouldCreatePendingRunWithTokenForClientTool() {
        ExecuteToolResponse response = service.execute("alice", reminder("k1"));

        assertEquals(ToolRunStatus.PENDING, response.getStatus());
        assertNotNull(response.getExecutionToken());
        assertEquals(43, response.getExecutionToken().length());
        assertTrue(response.getToolRunId().startsWith("toolrun_"));
        ToolRun stored = store.get(ToolRunService.COLLECTION, response.getToolRunId(), ToolRun.class).orElseThrow();
        assertEquals(response.getExecutionToken(), stored.getExecutionToken());
        assertEquals("alice", stored.getUid());
    }

    @Test
    void shouldAcceptReportWithMatchingTokenAndClearIt() {
        ExecuteToolResponse run = service.execute("alice", reminder("k1"));

        ToolRun updated = service.report("alice", result(run.getToolRunId(), run.getExecutionToken(), "executed"));

        assertEquals(ToolRunStatus.EXECUTED, updated.getStatus());
        assertNull(updated.getExecutionToken());
        assertEquals("r1", updated.getOutput().path("reminder_id").asText());
        assertNull(store.get(ToolRunService.COLLECTION, run.getToolRunId(), ToolRun.class).orElseThrow().getExecutionToken());
    }

    @Test
    void shouldRejectMismatchedTokenAndLeaveRunPending() {
        ExecuteToolResponse run = service.execute("alice", reminder("k1"));

        ApiException e = assertThrows(ApiException.class,
                () -> service.report("alice", result(run.getToolRunId(), run.getExecutionToken() + "x", "executed")));

        assertEquals(ErrorKind.FORBIDDEN, e.getKind());
        assertEquals("INVALID_TOKEN", e.getCode());
        ToolRun stored = store.get(ToolRunService.COLLECTION, run.getToolRunId(), ToolRun.class).orElseThrow();
        assertEquals(ToolRunStatus.PENDING, stored.getStatus());
        assertEquals(run.getExecutionToken(), stored.getExecutionToken());
    }

    @Test
    void shouldRejectSecondReportOnTerminalRun() {
        ExecuteToolResponse run = service.execute("alice", reminder("k1"));
        service.report("alice", result(run.getToolRunId(), run.getExecutionToken(), "declined"));

        ApiException e = assertThrows(ApiException.class,
                () -> service.report("alice", result(run.getToolRunId(), run.getExecutionToken(), "executed")));

        assertEquals(ErrorKind.CONFLICT, e.getKind());
        assertEquals("TOOL_RUN_TERMINAL", e.getCode());
        ToolRun stored = service.get("alice", run.getToolRunId());
        assertEquals(ToolRunStatus.DECLINED, stored.getStatus());
        assertNull(stored.getOutput());
    }

    @Test
    void shouldRejectReportFromAnotherUser() {
        ExecuteToolResponse run = service.execute("alice", reminder("k1"));

        ApiException e = assertThrows(ApiException.class,
                () -> service.report("bob", result(run.getToolRunId(), run.getExecutionToken(), "executed")));

        assertEquals("ACCESS_DENIED", e.getCode());
        assertThrows(ApiException.class, () -> service.get("bob", run.getToolRunId()));
    }

    @Test
    void shouldRejectUnknownStatusAndRun() {
        ApiException badStatus = assertThrows(ApiException.class,
                () -> service.report("alice", result("toolrun_x", "t", "pending")));
        assertEquals(ErrorKind.VALIDATION, badStatus.getKind());

        ApiException missing = assertThrows(ApiException.class,
                () -> service.report("alice", result("toolrun_x", "t", "executed")));
        assertEquals(ErrorKind.NOT_FOUND, missing.getKind());
    }

    @Test
    void shouldHideTokenWhenReadingRun() {
        ExecuteToolResponse run = service.execute("alice", reminder("k1"));

        ToolRun read = service.get("alice", run.getToolRunId());

        assertEquals(ToolRunStatus.PENDING, read.getStatus());
        assertNull(read.getExecutionToken());
    }

    @Test
    void shouldExecuteServerToolInlineWithoutToken() {
        ObjectNode input = mapper.createObjectNode();
        input.putObject("patch").putArray("commitments_add").addObject().put("text", "Walk daily");
        input.put("uid", "mallory");

        ExecuteToolResponse response = service.execute("alice", new ExecuteToolRequest("memory_write", null, input));

        assertEquals(ToolRunStatus.EXECUTED, response.getStatus());
        assertNull(response.getExecutionToken());
        assertEquals("updated", response.getOutput().path("status").asText());
        assertEquals(1, new MemoryService(store).load("alice").getCommitments().size());
        assertTrue(store.get("memory", "mallory", ObjectNode.class).isEmpty());
    }

    @Test
    void shouldStoreFailedServerRunAndRejectReportAgainstIt() {
        ObjectNode input = mapper.createObjectNode();
        input.putObject("patch").putArray("commitments_add").addObject().put("text", "my password is hunter2");

        ExecuteToolResponse response = service.execute("alice", new ExecuteToolRequest("memory_write", null, input));

        assertEquals(ToolRunStatus.FAILED, response.getStatus());
        assertTrue(response.getError().startsWith("rejected"));
        ApiException e = assertThrows(ApiException.class,
                () -> service.report("alice", result(response.getToolRunId(), "anything", "executed")));
        assertEquals("TOOL_RUN_TERMINAL", e.getCode());
    }

    @Test
    void shouldRejectUnknownToolAndInvalidInput() {
        ApiException unknown = assertThrows(ApiException.class,
                () -> service.execute("alice", new ExecuteToolRequest("launch_rocket", null, mapper.createObjectNode())));
        assertEquals("TOOL_NOT_FOUND", unknown.getCode());

        ApiException invalid = assertThrows(ApiException.class,
                () -> service.execute("alice", new ExecuteToolRequest("reminder_create", null, mapper.createObjectNode())));
        assertEquals("INVALID_INPUT", invalid.getCode());
        assertTrue(invalid.getMessage().contains("$.title: is required"));
    }

    @Test
    void shouldRequireEntitlementForProOnlyTool() {
        ObjectNode input = mapper.createObjectNode().put("format", "pdf").put("idempotency_key", "k");
        input.putObject("payload_ref").put("type", "plan").put("id", "p1");

        ApiException e = assertThrows(ApiException.class,
                () -> service.execute("alice", new ExecuteToolRequest("share_sheet_export", null, input)));

        assertEquals("ENTITLEMENT_REQUIRED", e.getCode());
        assertEquals(ErrorKind.FORBIDDEN, e.getKind());
    }

    @Test
    void shouldRateLimitPerUserAndTool() {
        properties.getTools().getRateLimit().setCapacity(1);
        properties.getTools().getRateLimit().setWindow(Duration.ofHours(1));
        service = newService();
        service.execute("alice", reminder("k1"));

        ApiException e = assertThrows(ApiException.class, () -> service.execute("alice", reminder("k2")));

        assertEquals(ErrorKind.RATE_LIMITED, e.getKind());
        assertTrue(e.getRetryAfterSeconds() > 0);
    }

    @Test
    void shouldCheckSessionOwnership() {
        Session bobs = sessions.create("bob", null, null);
        ExecuteToolRequest request = reminder("k1");
        request.setSessionId(bobs.getId());

        ApiException e = assertThrows(ApiException.class, () -> service.execute("alice", request));

        assertEquals(ErrorKind.FORBIDDEN, e.getKind());
    }

    private ToolRunService newService() {
        ServerToolExecutor serverTools = new ServerToolExecutor(
                new MemoryService(store), new PlanService(store), new CheckinService(store), mapper);
        return new ToolRunService(new ToolRegistry(mapper), new SchemaValidator(), new EntitlementService(properties),
                new ToolRateLimiter(properties), sessions, serverTools, store, new SimpleMeterRegistry());
    }
}
