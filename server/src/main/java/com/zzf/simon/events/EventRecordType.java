package com.zzf.simon.events;

import com.zzf.simon.api.ApiException;

/**
 * Kinds of durable side-effect records. The path segment, backing collection and list order differ per kind.
 */
public enum EventRecordType {
    CALENDAR("calendar", "calendar_events", "start_iso", true),
    REMINDERS("reminders", "reminders", "created_at", false),
    NOTIFICATIONS("notifications", "scheduled_notifications", "created_at", false);

    private final String path;
    private final String collection;
    private final String orderField;
    private final boolean ascending;

    EventRecordType(String path, String collection, String orderField, boolean ascending) {
        this.path = path;
        this.collection = collection;
        this.orderField = orderField;
        this.ascending = ascending;
    }

    public String path() {
        return path;
    }

    public String collection() {
        return collection;
    }

    public String orderField() {
        return orderField;
    }

    public boolean ascending() {
        return ascending;
    }

    public static EventRecordType fromPath(String value) {
        for (EventRecordType type : values()) {
            if (type.path.equals(value)) {
                return type;
            }
        }
        throw ApiException.notFound("UNKNOWN_EVENT_KIND", "unknown event kind: " + value);
    }
}
