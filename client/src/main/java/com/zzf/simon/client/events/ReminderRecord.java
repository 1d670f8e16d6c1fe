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

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReminderRecord {
    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_COMPLETED = "completed";

    private String id;
    private String uid;
    private String coachId;
    private String sessionId;
    private String toolRunId;
    private String title;
    private String notes;
    private String dueIso;
    private Integer priority;
    private List<EventAlarm> alarms;
    private String reminderIdentifier;
    private String nativeStatus;
    private String status;
    private String completedAt;
    private String createdAt;
    private String updatedAt;
}
