package com.zzf.simon.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.simon.tool.SchemaValidator;
import com.zzf.simon.tool.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ToolProposerTest {

    private ToolRegistry registry;
    private ToolProposer proposer;
    private final SchemaValidator validator = new SchemaValidator();

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry(new ObjectMapper());
        proposer = new ToolProposer(registry, Clock.fixed(Instant.parse("2026-03-02T09:41:00Z"), ZoneOffset.UTC));
    }

    @Test
    void shouldProposeNothingWithoutKeywords() {
        assertTrue(proposer.propose("Take a short walk and breathe.", "I'm stuck", CoachBlueprint.defaultBlueprint()).isEmpty());
    }

    @Test
    void shouldProposeSchemaValidCalendarEvent() {
        List<ObjectNode> requests = proposer.propose("Let's schedule 30 minutes for it.", "Write the report", CoachBlueprint.defaultBlueprint());

        assertEquals(1, requests.size());
        ObjectNode request = requests.get(0);
        assertEquals(ToolProposer.CALENDAR, request.path("tool_id").asText());
        assertEquals(ToolProposer.CALENDAR, request.path("tool").asText());
        assertTrue(request.path("requires_confirmation").asBoolean());
        assertEquals(request.path("request_id").asText(), request.path("input").path("idempotency_key").asText());
        assertEquals("Write the report", request.path("input").path("title").asText());
        assertEquals("2026-03-02T11:00:00.000Z", request.path("input").path("start_iso").asText());
        assertEquals("2026-03-02T11:30:00.000Z", request.path("input").path("end_iso").asText());
        assertEquals(List.of(), validator.validate(registry.find(ToolProposer.CALENDAR).orElseThrow().getSchema(), request.get("input")));
    }

    @Test
    void shouldProposeEveryMatchingToolWithValidInput() {
        List<ObjectNode> requests = proposer.propose("I'll remind you, and notify you in an hour. Or add it to your calendar.",
                "Stretch", CoachBlueprint.defaultBlueprint());

        assertEquals(3, requests.size());
        for (ObjectNode request : requests) {
            String toolId = request.path("tool_id").asText();
            assertEquals(List.of(), validator.validate(registry.find(toolId).orElseThrow().getSchema(), request.get("input")), toolId);
        }
        assertNotEquals(requests.get(0).path("request_id").asText(), requests.get(1).path("request_id").asText());
    }

    @Test
    void shouldSkipToolsTheCoachDoesNotAllow() {
        CoachBlueprint noTools = CoachBlueprint.builder().id("c1").build();

        assertTrue(proposer.propose("I'll remind you tomorrow.", "Stretch", noTools).isEmpty());
    }

    @Test
    void shouldDeriveTitleFromUserMessage() {
        assertEquals("Next step", ToolProposer.titleFrom("   "));
        assertEquals("a b", ToolProposer.titleFrom(" a \n b "));
        assertEquals(120, ToolProposer.titleFrom("x".repeat(300)).length());
    }
}
