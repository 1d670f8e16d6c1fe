package com.zzf.simon.client.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.zzf.simon.client.tool.EventAlarm;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Stored under {@code calendar_events}; the id is the tool input's idempotency key.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CalendarEventRecord {
    public static final String STATUS_UPCOMING = "upcoming";
    public static final String STATUS_PAST = "past";

    private String id;
    private String uid;
    private String coachId;
    private String sessionId;
    private String toolRunId;
    private String title;
    private String startIso;
    private String endIso;
    private String location;
    private String notes;
    private List<EventAlarm> alarms;
    private String eventIdentifier;
    private String nativeStatus;
    private String status;
    private String createdAt;
    private String updatedAt;
}
