package com.zzf.simon.client.events;

import com.zzf.simon.client.SimonApiClient;
import com.zzf.simon.client.SimonApiException;
import com.zzf.simon.client.tool.CalendarEventInput;
import com.zzf.simon.client.tool.NativeResult;
import com.zzf.simon.client.tool.NotificationInput;
import com.zzf.simon.client.tool.NotificationTrigger;
import com.zzf.simon.client.tool.ReminderInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EventPersistenceServiceTest {
    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");
    private static final RecordContext CONTEXT = new RecordContext("coach_a", "ses_1", "run_1");

    private SimonApiClient api;
    private List<Long> sleeps;
    private EventPersistenceService service;

    @BeforeEach
    void setUp() {
        api = mock(SimonApiClient.class);
        sleeps = new ArrayList<>();
        service = new EventPersistenceService(api, Clock.fixed(NOW, ZoneOffset.UTC), 3, Duration.ofSeconds(1), sleeps::add);
    }

    @Test
    void calendar_record_should_be_keyed_by_idempotency_key_with_status_at_write_time() {
        when(api.saveCalendarEvent(any())).thenAnswer(inv -> inv.getArgument(0));
        CalendarEventInput ended = CalendarEventInput.builder()
                .title("Standup")
                .startIso("2026-03-02T09:00:00.000Z")
                .endIso("2026-03-02T09:15:00.000Z")
                .idempotencyKey("k1")
                .build();
        CalendarEventInput later = CalendarEventInput.builder()
                .title("Review")
                .startIso("2026-03-02T12:30:00.000Z")
                .endIso("2026-03-02T13:00:00.000Z")
                .idempotencyKey("k2")
                .build();

        CalendarEventRecord past = service.saveCalendarEvent(CONTEXT, ended, new NativeResult("EK-1", "saved"));
        CalendarEventRecord upcoming = service.saveCalendarEvent(CONTEXT, later, new NativeResult("EK-2", "saved"));

        assertEquals("k1", past.getId());
        assertEquals(CalendarEventRecord.STATUS_PAST, past.getStatus());
        assertEquals("EK-1", past.getEventIdentifier());
        assertEquals("coach_a", past.getCoachId());
        assertEquals("run_1", past.getToolRunId());
        assertEquals(CalendarEventRecord.STATUS_UPCOMING, upcoming.getStatus());
    }

    @Test
    void end_time_equal_to_now_should_still_be_upcoming() {
        assertEquals(CalendarEventRecord.STATUS_UPCOMING, EventPersistenceService.calendarStatus("2026-03-02T12:00:00.000Z", NOW));
        assertEquals(CalendarEventRecord.STATUS_PAST, EventPersistenceService.calendarStatus("2026-03-02T11:59:59.999Z", NOW));
    }

    @Test
    void transient_failures_should_be_retried_with_exponential_backoff() {
        ReminderRecord stored = ReminderRecord.builder().id("r1").status(ReminderRecord.STATUS_PENDING).build();
        when(api.saveReminder(any()))
                .thenThrow(SimonApiException.network("offline", null))
                .thenThrow(SimonApiException.fromStatus(503, "STORE_UNAVAILABLE", "busy", null))
                .thenReturn(stored);

        ReminderRecord saved = service.saveReminder(CONTEXT,
                ReminderInput.builder().title("Stretch").idempotencyKey("r1").build(), new NativeResult("R-1", "saved"));

        assertEquals("r1", saved.getId());
        assertEquals(List.of(1000L, 2000L), sleeps);
        ArgumentCaptor<ReminderRecord> captor = ArgumentCaptor.forClass(ReminderRecord.class);
        verify(api, times(3)).saveReminder(captor.capture());
        assertTrue(captor.getAllValues().stream().allMatch(r -> "r1".equals(r.getId())));
        assertEquals(ReminderRecord.STATUS_PENDING, captor.getValue().getStatus());
    }

    @Test
    void permanent_failure_should_not_be_retried() {
        when(api.saveNotification(any())).thenThrow(SimonApiException.fromStatus(403, "ACCESS_DENIED", "not yours", null));
        NotificationInput input = NotificationInput.builder()
                .title("Check in")
                .trigger(NotificationTrigger.builder().kind(NotificationTrigger.AFTER_DELAY).delaySec(3600L).build())
                .idempotencyKey("n1")
                .build();

        SimonApiException error = assertThrows(SimonApiException.class,
                () -> service.saveNotification(CONTEXT, input, new NativeResult("N-1", "scheduled")));

        assertEquals(SimonApiException.Kind.FORBIDDEN, error.getKind());
        assertTrue(sleeps.isEmpty());
        ArgumentCaptor<NotificationRecord> captor = ArgumentCaptor.forClass(NotificationRecord.class);
        verify(api).saveNotification(captor.capture());
        assertEquals(NotificationRecord.STATUS_SCHEDULED, captor.getValue().getStatus());
        assertEquals("n1", captor.getValue().getId());
    }
}
