package com.zzf.simon.client.events;

import lombok.Value;

/**
 * Who a side-effect record belongs to. The server stamps the uid from the caller's credentials.
 */
@Value
public class RecordContext {
    String coachId;
    String sessionId;
    String toolRunId;
}
