package com.zzf.simon.pipeline;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;

/**
 * Structured cards extracted from a reply. Each part may be null.
 */
@Value
public class PlannerOutput {
    ObjectNode plan;
    ArrayNode nextActions;
    ObjectNode weeklyReview;

    public static PlannerOutput empty() {
        return new PlannerOutput(null, null, null);
    }
}
