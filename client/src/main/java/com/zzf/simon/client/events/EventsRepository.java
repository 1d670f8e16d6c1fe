package com.zzf.simon.client.events;

import com.zzf.simon.client.SimonApiClient;
import com.zzf.simon.client.SimonApiException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cached side-effect records for the UI. Completing a reminder or cancelling a notification updates the
 * cache before the server answers and restores the previous record if the server rejects the change.
 */
@Slf4j
public class EventsRepository {
    private final SimonApiClient api;
    private final Clock clock;
    private final Map<String, CalendarEventRecord> calendarEvents = new LinkedHashMap<>();
    private final Map<String, ReminderRecord> reminders = new LinkedHashMap<>();
    private final Map<String, NotificationRecord> notifications = new LinkedHashMap<>();

    public EventsRepository(SimonApiClient api) {
        this(api, Clock.systemUTC());
    }

    public EventsRepository(SimonApiClient api, Clock clock) {
        this.api = api;
        this.clock = clock;
    }

    public List<CalendarEventRecord> loadCalendarEvents(EventQuery query) {
        List<CalendarEventRecord> loaded = api.listCalendarEvents(query);
        synchronized (this) {
            calendarEvents.clear();
            loaded.forEach(r -> calendarEvents.put(r.getId(), r));
        }
        return loaded;
    }

    public List<ReminderRecord> loadReminders(EventQuery query) {
        List<ReminderRecord> loaded = api.listReminders(query);
        synchronized (this) {
            reminders.clear();
            loaded.forEach(r -> reminders.put(r.getId(), r));
        }
        return loaded;
    }

    public List<NotificationRecord> loadNotifications(EventQuery query) {
        List<NotificationRecord> loaded = api.listNotifications(query);
        synchronized (this) {
            notifications.clear();
            loaded.forEach(r -> notifications.put(r.getId(), r));
        }
        return loaded;
    }

    public synchronized List<CalendarEventRecord> calendarEvents() {
        return new ArrayList<>(calendarEvents.values());
    }

    public synchronized List<ReminderRecord> reminders() {
        return new ArrayList<>(reminders.values());
    }

    public synchronized List<NotificationRecord> notifications() {
        return new ArrayList<>(notifications.values());
    }

    public ReminderRecord completeReminder(String id) {
        String now = clock.instant().toString();
        ReminderRecord previous;
        synchronized (this) {
            previous = reminders.get(id);
            if (previous != null) {
                reminders.put(id, previous.toBuilder().status(ReminderRecord.STATUS_COMPLETED).completedAt(now).build());
            }
        }
        try {
            ReminderRecord saved = api.completeReminder(id);
            synchronized (this) {
                reminders.put(id, saved);
            }
            return saved;
        } catch (SimonApiException e) {
            synchronized (this) {
                if (previous != null) {
                    reminders.put(id, previous);
                }
            }
            log.warn("events.complete_rolled_back id={} code={}", id, e.getCode());
            throw e;
        }
    }

    public NotificationRecord cancelNotification(String id) {
        String now = clock.instant().toString();
        NotificationRecord previous;
        synchronized (this) {
            previous = notifications.get(id);
            if (previous != null) {
                notifications.put(id, previous.toBuilder().status(NotificationRecord.STATUS_CANCELLED).cancelledAt(now).build());
            }
        }
        try {
            NotificationRecord saved = api.cancelNotification(id);
            synchronized (this) {
                notifications.put(id, saved);
            }
            return saved;
        } catch (SimonApiException e) {
            synchronized (this) {
                if (previous != null) {
                    notifications.put(id, previous);
                }
            }
            log.warn("events.cancel_rolled_back id={} code={}", id, e.getCode());
            throw e;
        }
    }
}
