package com.zzf.simon.client.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.simon.client.ToolRunInfo;
import lombok.Value;

@Value
public class ToolOutcome {

    public enum Kind {
        EXECUTED,
        FAILED,
        DECLINED,
        PERMISSION_DENIED,
        /** Confirmation was interrupted; the run is parked for {@link ToolExecutor#resume(String)}. */
        PENDING,
        /** A resumed run the server had already closed; nothing was executed or reported. */
        ALREADY_TERMINAL
    }

    Kind kind;
    String toolRunId;
    JsonNode output;
    String error;
    /** False when the result could not be delivered to the server. */
    boolean reported;

    static ToolOutcome pending(String toolRunId) {
        return new ToolOutcome(Kind.PENDING, toolRunId, null, null, false);
    }

    static ToolOutcome alreadyTerminal(String toolRunId, ToolRunInfo info) {
        return new ToolOutcome(Kind.ALREADY_TERMINAL, toolRunId, info.getOutput(), info.getError(), true);
    }
}
