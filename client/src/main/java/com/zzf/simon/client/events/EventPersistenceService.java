package com.zzf.simon.client.events;

import com.zzf.simon.client.SimonApiClient;
import com.zzf.simon.client.SimonApiException;
import com.zzf.simon.client.SimonClientConfig;
import com.zzf.simon.client.tool.CalendarEventInput;
import com.zzf.simon.client.tool.NativeResult;
import com.zzf.simon.client.tool.NotificationInput;
import com.zzf.simon.client.tool.ReminderInput;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.function.Supplier;

/**
 * Writes the durable record of a device-side effect. The record id is the tool input's idempotency key,
 * so a retried write overwrites the earlier one. Display status is computed once, at write time.
 */
@Slf4j
public class EventPersistenceService {

    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final SimonApiClient api;
    private final Clock clock;
    private final int maxAttempts;
    private final long baseDelayMs;
    private final Sleeper sleeper;

    public EventPersistenceService(SimonApiClient api, SimonClientConfig config) {
        this(api, Clock.systemUTC(), config.getRecordWriteAttempts(), config.getRecordRetryBase(), Thread::sleep);
    }

    public EventPersistenceService(SimonApiClient api, Clock clock, int maxAttempts, Duration baseDelay, Sleeper sleeper) {
        this.api = api;
        this.clock = clock;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelayMs = baseDelay.toMillis();
        this.sleeper = sleeper;
    }

    public CalendarEventRecord saveCalendarEvent(RecordContext context, CalendarEventInput input, NativeResult result) {
        CalendarEventRecord record = CalendarEventRecord.builder()
                .id(recordId(input.getIdempotencyKey(), context))
                .coachId(context.getCoachId())
                .sessionId(context.getSessionId())
                .toolRunId(context.getToolRunId())
                .title(input.getTitle())
                .startIso(input.getStartIso())
                .endIso(input.getEndIso())
                .location(input.getLocation())
                .notes(input.getNotes())
                .alarms(input.getAlarms())
                .eventIdentifier(result.getNativeId())
                .nativeStatus(result.getNativeStatus())
                .status(calendarStatus(input.getEndIso(), clock.instant()))
                .build();
        return withRetry("calendar " + record.getId(), () -> api.saveCalendarEvent(record));
    }

    public ReminderRecord saveReminder(RecordContext context, ReminderInput input, NativeResult result) {
        ReminderRecord record = ReminderRecord.builder()
                .id(recordId(input.getIdempotencyKey(), context))
                .coachId(context.getCoachId())
                .sessionId(context.getSessionId())
                .toolRunId(context.getToolRunId())
                .title(input.getTitle())
                .notes(input.getNotes())
                .dueIso(input.getDueIso())
                .priority(input.getPriority())
                .alarms(input.getAlarms())
                .reminderIdentifier(result.getNativeId())
                .nativeStatus(result.getNativeStatus())
                .status(ReminderRecord.STATUS_PENDING)
                .build();
        return withRetry("reminder " + record.getId(), () -> api.saveReminder(record));
    }

    public NotificationRecord saveNotification(RecordContext context, NotificationInput input, NativeResult result) {
        NotificationRecord record = NotificationRecord.builder()
                .id(recordId(input.getIdempotencyKey(), context))
                .coachId(context.getCoachId())
                .sessionId(context.getSessionId())
                .toolRunId(context.getToolRunId())
                .title(input.getTitle())
                .body(input.getBody())
                .trigger(input.getTrigger())
                .deepLink(input.getDeepLink())
                .notificationIdentifier(result.getNativeId())
                .nativeStatus(result.getNativeStatus())
                .status(NotificationRecord.STATUS_SCHEDULED)
                .build();
        return withRetry("notification " + record.getId(), () -> api.saveNotification(record));
    }

    /**
     * {@code upcoming} while the event has not ended. An unreadable end time counts as upcoming.
     */
    static String calendarStatus(String endIso, Instant now) {
        if (endIso == null || endIso.isBlank()) {
            return CalendarEventRecord.STATUS_UPCOMING;
        }
        try {
            Instant end = OffsetDateTime.parse(endIso).toInstant();
            return end.isBefore(now) ? CalendarEventRecord.STATUS_PAST : CalendarEventRecord.STATUS_UPCOMING;
        } catch (DateTimeParseException e) {
            log.warn("events.bad_end_time value={}", endIso);
            return CalendarEventRecord.STATUS_UPCOMING;
        }
    }

    long getDelay(int attempt) {
        return baseDelayMs * (1L << (attempt - 1));
    }

    private <T> T withRetry(String operation, Supplier<T> action) {
        SimonApiException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                try {
                    sleeper.sleep(getDelay(attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw SimonApiException.network(operation + " interrupted during backoff", e);
                }
            }
            try {
                return action.get();
            } catch (SimonApiException e) {
                if (!e.isTransient()) {
                    throw e;
                }
                last = e;
                log.warn("events.retry op={} attempt={}/{} kind={} msg={}", operation, attempt, maxAttempts, e.getKind(), e.getMessage());
            }
        }
        throw last;
    }

    private static String recordId(String idempotencyKey, RecordContext context) {
        return idempotencyKey == null || idempotencyKey.isBlank() ? context.getToolRunId() : idempotencyKey;
    }
}
