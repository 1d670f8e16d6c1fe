package com.zzf.simon.tool.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.simon.store.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanServiceTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private InMemoryDocumentStore store;
    private PlanService plans;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore(mapper);
        plans = new PlanService(store);
    }

    private ObjectNode plan(String title) {
        ObjectNode plan = mapper.createObjectNode().put("title", title).put("objective", "Get it done").put("horizon", "week");
        plan.putArray("milestones").addObject().put("label", "Draft");
        plan.putArray("next_actions").addObject().put("title", "Open the doc");
        return plan;
    }

    @Test
    void shouldCreatePlanWithIds() {
        String planId = plans.create("alice", "coach_1", plan("Report")).path("plan_id").asText();

        ObjectNode stored = store.get(PlanService.COLLECTION, planId, ObjectNode.class).orElseThrow();
        assertEquals("alice", stored.path("uid").asText());
        assertEquals("active", stored.path("status").asText());
        assertEquals("milestone_1", stored.path("milestones").get(0).path("id").asText());
        assertEquals("action_1", stored.path("next_actions").get(0).path("id").asText());
        assertEquals("pending", stored.path("next_actions").get(0).path("status").asText());
    }

    @Test
    void shouldRejectTooManyMilestones() {
        ObjectNode plan = plan("Big");
        ArrayNode milestones = plan.putArray("milestones");
        for (int i = 0; i < PlanService.MAX_MILESTONES + 1; i++) {
            milestones.addObject().put("label", "m" + i);
        }

        ToolFailure failure = assertThrows(ToolFailure.class, () -> plans.create("alice", null, plan));
        assertTrue(failure.getMessage().contains("too many milestones"));
    }

    @Test
    void shouldUpdateOnlyOwnPlanAndKeepProtectedKeys() {
        String planId = plans.create("alice", null, plan("Report")).path("plan_id").asText();
        ObjectNode updates = mapper.createObjectNode().put("title", "Final report").put("uid", "mallory");

        plans.update("alice", planId, updates);

        ObjectNode stored = store.get(PlanService.COLLECTION, planId, ObjectNode.class).orElseThrow();
        assertEquals("Final report", stored.path("title").asText());
        assertEquals("alice", stored.path("uid").asText());
        assertThrows(ToolFailure.class, () -> plans.update("bob", planId, updates));
        assertThrows(ToolFailure.class, () -> plans.update("alice", "plan_missing", updates));
    }

    @Test
    void shouldListActivePlansOfCaller() {
        plans.create("alice", null, plan("One"));
        String second = plans.create("alice", null, plan("Two")).path("plan_id").asText();
        plans.create("bob", null, plan("Bob's"));
        plans.update("alice", second, mapper.createObjectNode().put("status", "archived"));

        List<ObjectNode> active = plans.listActive("alice", 0);

        assertEquals(1, active.size());
        assertEquals("One", active.get(0).path("title").asText());
        assertEquals(1, plans.listActiveOutput("alice", 5).path("plans").size());
    }
}
