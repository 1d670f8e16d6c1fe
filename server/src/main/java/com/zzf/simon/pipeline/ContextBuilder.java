package com.zzf.simon.pipeline;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.simon.config.SimonProperties;
import com.zzf.simon.session.Message;
import com.zzf.simon.session.Session;
import com.zzf.simon.session.SessionService;
import com.zzf.simon.tool.server.MemoryService;
import com.zzf.simon.tool.server.PlanService;
import com.zzf.simon.tool.server.UserMemory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class ContextBuilder {
    private static final int ACTIVE_PLAN_LIMIT = 3;

    private final BlueprintResolver blueprints;
    private final SessionService sessionService;
    private final PlanService planService;
    private final MemoryService memoryService;
    private final SimonProperties properties;

    public CoachContext build(String uid, Session session, String currentMessageId, Route route) {
        List<Message> history = sessionService.getMessages(session.getId()).stream()
                .filter(m -> !m.getId().equals(currentMessageId))
                .collect(Collectors.toList());
        int limit = properties.getStream().getHistoryLimit();
        if (history.size() > limit) {
            history = history.subList(history.size() - limit, history.size());
        }
        List<ObjectNode> plans = route.wants(Route.ContextKey.ACTIVE_PLANS)
                ? planService.listActive(uid, ACTIVE_PLAN_LIMIT)
                : Collections.emptyList();
        UserMemory memory = route.wants(Route.ContextKey.PREFERENCES) || route.wants(Route.ContextKey.COMMITMENTS)
                ? memoryService.load(uid)
                : null;
        return CoachContext.builder()
                .blueprint(blueprints.resolve(session))
                .history(history)
                .activePlans(plans)
                .memory(memory)
                .build();
    }
}
