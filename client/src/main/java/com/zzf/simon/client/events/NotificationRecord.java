package com.zzf.simon.client.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.zzf.simon.client.tool.DeepLink;
import com.zzf.simon.client.tool.NotificationTrigger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotificationRecord {
    public static final String STATUS_SCHEDULED = "scheduled";
    public static final String STATUS_CANCELLED = "cancelled";

    private String id;
    private String uid;
    private String coachId;
    private String sessionId;
    private String toolRunId;
    private String title;
    private String body;
    private NotificationTrigger trigger;
    private DeepLink deepLink;
    private String notificationIdentifier;
    private String nativeStatus;
    private String status;
    private String deliveredAt;
    private String cancelledAt;
    private String createdAt;
    private String updatedAt;
}
