package com.zzf.simon.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.simon.config.SimonProperties;
import com.zzf.simon.envelope.EventType;
import com.zzf.simon.llm.LlmException;
import com.zzf.simon.llm.LlmService;
import com.zzf.simon.session.Message;
import com.zzf.simon.session.Session;
import com.zzf.simon.session.SessionService;
import com.zzf.simon.store.InMemoryDocumentStore;
import com.zzf.simon.tool.ToolRegistry;
import com.zzf.simon.tool.server.MemoryService;
import com.zzf.simon.tool.server.PlanService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.when;

class CoachingPipelineTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private LlmService llm;
    private SessionService sessions;
    private CoachingPipeline pipeline;
    private Session session;
    private RecordingSink sink;

    @BeforeEach
    void setUp() {
        InMemoryDocumentStore store = new InMemoryDocumentStore(mapper);
        llm = Mockito.mock(LlmService.class);
        sessions = new SessionService(store);
        ContextBuilder contextBuilder = new ContextBuilder(new BlueprintResolver(store), sessions,
                new PlanService(store), new MemoryService(store), new SimonProperties());
        pipeline = new CoachingPipeline(new IntentRouter(llm, mapper), contextBuilder, new CoachAgent(llm),
                new ToolProposer(new ToolRegistry(mapper)), new PlannerAgent(llm, mapper), new SafetyFilter(), sessions);
        session = sessions.create("alice", null, null);
        sink = new RecordingSink();
    }

    private PipelineInput turn(String text) {
        Message user = sessions.appendMessage(session.getId(), Message.ROLE_USER, text);
        return PipelineInput.builder()
                .uid("alice")
                .session(session)
                .userMessageId(user.getId())
                .userMessage(text)
                .build();
    }

    private void streamReply(String... parts) {
        when(llm.stream(any(), any(), any())).thenAnswer(inv -> {
            LlmService.StreamCallback callback = inv.getArgument(1);
            StringBuilder text = new StringBuilder();
            for (String part : parts) {
                callback.onDelta(part);
                text.append(part);
            }
            return text.toString();
        });
    }

    private List<Message> assistantMessages() {
        return sessions.getMessages(session.getId()).stream()
                .filter(m -> Message.ROLE_ASSISTANT.equals(m.getRole()))
                .collect(java.util.stream.Collectors.toList());
    }

    @Test
    void shouldStreamQuickNudgeAndPersistOnce() {
        when(llm.complete(anyString())).thenReturn("{\"route\":\"quick_nudge\",\"confidence\":0.9}");
        streamReply("Pick ", "one tiny ", "task.");

        pipeline.run(turn("I'm stuck"), sink);

        assertEquals(List.of(EventType.MESSAGE_DELTA, EventType.MESSAGE_DELTA, EventType.MESSAGE_DELTA,
                EventType.MESSAGE_FINAL, EventType.STREAM_DONE), sink.types);
        JsonNode fin = sink.payloadsOf(EventType.MESSAGE_FINAL).get(0);
        assertEquals("Pick one tiny task.", fin.path("text").asText());
        assertEquals(sink.deltaText(), fin.path("text").asText());
        assertEquals("ok", sink.payloadsOf(EventType.STREAM_DONE).get(0).path("status").asText());

        List<Message> stored = assistantMessages();
        assertEquals(1, stored.size());
        assertEquals("Pick one tiny task.", stored.get(0).getContentText());
        assertEquals(stored.get(0).getId(), fin.path("message_id").asText());
    }

    @Test
    void shouldDiscardPartialTextWhenModelFails() {
        when(llm.complete(anyString())).thenReturn("{\"route\":\"deep_session\"}");
        when(llm.stream(any(), any(), any())).thenAnswer(inv -> {
            LlmService.StreamCallback callback = inv.getArgument(1);
            callback.onDelta("Half a ");
            throw new LlmException("model stream failed: connection reset", null);
        });

        pipeline.run(turn("help me think"), sink);

        assertEquals(List.of(EventType.MESSAGE_DELTA, EventType.ERROR), sink.types);
        JsonNode error = sink.payloadsOf(EventType.ERROR).get(0);
        assertEquals("COACH_ERROR", error.path("code").asText());
        assertTrue(error.path("message").asText().startsWith("Failed to generate response: "));
        assertTrue(assistantMessages().isEmpty());
    }

    @Test
    void shouldReportRouterFailureAsError() {
        when(llm.complete(anyString())).thenThrow(new LlmException("classifier call failed: timeout", null));

        pipeline.run(turn("I'm stuck"), sink);

        assertEquals(List.of(EventType.ERROR), sink.types);
        assertEquals("ROUTER_ERROR", sink.payloadsOf(EventType.ERROR).get(0).path("code").asText());
    }

    @Test
    void shouldEmitToolRequestsAfterFinal() {
        streamReply("I'll remind you tonight.");

        pipeline.run(turn("Remind me to stretch"), sink);

        assertEquals(List.of(EventType.MESSAGE_DELTA, EventType.MESSAGE_FINAL, EventType.TOOL_REQUEST, EventType.STREAM_DONE),
                sink.types);
        JsonNode request = sink.payloadsOf(EventType.TOOL_REQUEST).get(0);
        assertEquals("reminder_create", request.path("tool_id").asText());
        assertEquals("Remind me to stretch", request.path("input").path("title").asText());
    }

    @Test
    void shouldEmitCardsForPlannerRoutes() {
        streamReply("Here is a system for your mornings.");
        when(llm.complete(startsWith("Extract"))).thenReturn(
                "{\"plan\":{\"title\":\"Mornings\",\"objective\":\"Start calm\",\"horizon\":\"week\"},\"next_actions\":[{\"title\":\"Lay out clothes\"}]}");

        pipeline.run(turn("I need a system for my mornings"), sink);

        assertEquals(List.of(EventType.MESSAGE_DELTA, EventType.MESSAGE_FINAL, EventType.CARD_PLAN,
                EventType.CARD_NEXT_ACTIONS, EventType.STREAM_DONE), sink.types);
        assertEquals("Plan.v1", sink.payloadsOf(EventType.CARD_PLAN).get(0).path("schema").asText());
        assertEquals("na_1", sink.payloadsOf(EventType.CARD_NEXT_ACTIONS).get(0).path("items").get(0).path("id").asText());
    }

    @Test
    void shouldWarnWhenPlannerFails() {
        streamReply("Here is a habit loop.");
        when(llm.complete(startsWith("Extract"))).thenThrow(new LlmException("classifier call failed: 500", null));

        pipeline.run(turn("Help me build a reading habit"), sink);

        assertEquals(List.of(EventType.MESSAGE_DELTA, EventType.MESSAGE_FINAL, EventType.POLICY_NOTICE, EventType.STREAM_DONE),
                sink.types);
        assertEquals("planner_warning", sink.payloadsOf(EventType.POLICY_NOTICE).get(0).path("kind").asText());
        assertEquals(1, assistantMessages().size());
    }

    @Test
    void shouldAddSafetyNoticeAfterDeliveringReply() {
        when(llm.complete(anyString())).thenReturn("{\"route\":\"quick_nudge\"}");
        streamReply("A doctor should look at that medication.");

        pipeline.run(turn("I feel tired all the time"), sink);

        assertEquals(List.of(EventType.MESSAGE_DELTA, EventType.MESSAGE_FINAL, EventType.POLICY_NOTICE, EventType.STREAM_DONE),
                sink.types);
        assertEquals("safety_boundary", sink.payloadsOf(EventType.POLICY_NOTICE).get(0).path("kind").asText());
    }

    @Test
    void shouldStaySilentWhenCancelled() {
        when(llm.complete(anyString())).thenReturn("{\"route\":\"quick_nudge\"}");
        when(llm.stream(any(), any(), any())).thenAnswer(inv -> {
            LlmService.StreamCallback callback = inv.getArgument(1);
            BooleanSupplier cancelled = inv.getArgument(2);
            callback.onDelta("Start ");
            sink.open = false;
            assertTrue(cancelled.getAsBoolean());
            throw new CancellationException("model stream cancelled");
        });

        pipeline.run(turn("I'm stuck"), sink);

        assertEquals(List.of(EventType.MESSAGE_DELTA), sink.types);
        assertTrue(assistantMessages().isEmpty());
    }

    @Test
    void shouldNotPersistWhenClientLeftDuringReply() {
        when(llm.complete(anyString())).thenReturn("{\"route\":\"quick_nudge\"}");
        when(llm.stream(any(), any(), any())).thenAnswer(inv -> {
            sink.open = false;
            return "Finished anyway.";
        });

        pipeline.run(turn("I'm stuck"), sink);

        assertTrue(sink.types.isEmpty());
        assertTrue(assistantMessages().isEmpty());
    }

    @Test
    void shouldNotPersistWhenStreamClosedAfterReplyCheck() {
        when(llm.complete(anyString())).thenReturn("{\"route\":\"quick_nudge\"}");
        streamReply("Done just ", "in time.");
        sink.openChecksLeft = 1;

        pipeline.run(turn("I'm stuck"), sink);

        assertEquals(List.of(EventType.MESSAGE_DELTA, EventType.MESSAGE_DELTA), sink.types);
        assertTrue(assistantMessages().isEmpty());
    }
}
