package com.zzf.simon.client.stream;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TurnResult {

    public enum Status {
        COMPLETED,
        FAILED,
        CANCELLED
    }

    Status status;
    String messageId;
    /** Final assistant text; the accumulated deltas when no {@code message.final} arrived. */
    String text;
    String errorCode;
    String errorMessage;
    @Singular
    List<StreamEvent.ToolRequest> toolRequests;
}
