package com.zzf.simon.pipeline;

import com.zzf.simon.session.Session;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PipelineInput {
    String uid;
    /** Already ownership-checked. */
    Session session;
    /** Id of the persisted user message for this turn. */
    String userMessageId;
    String userMessage;
}
