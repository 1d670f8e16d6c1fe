package com.zzf.simon.pipeline;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.simon.session.Message;
import com.zzf.simon.tool.server.UserMemory;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything the coach prompt is built from for one turn.
 */
@Value
@Builder
public class CoachContext {
    CoachBlueprint blueprint;
    /** Prior turns, oldest first, excluding the current user message. */
    List<Message> history;
    List<ObjectNode> activePlans;
    /** Null when the route asks for neither preferences nor commitments. */
    UserMemory memory;
}
