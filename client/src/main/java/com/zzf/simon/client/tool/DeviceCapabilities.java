package com.zzf.simon.client.tool;

import java.util.concurrent.CompletableFuture;

/**
 * OS-level capabilities the server is never trusted with. Implementations bridge to the platform's
 * notification, calendar and reminder APIs; permission prompts complete asynchronously.
 */
public interface DeviceCapabilities {

    CompletableFuture<Boolean> requestPermission(DevicePermission permission);

    NativeResult scheduleNotification(NotificationInput input) throws DeviceActionException;

    NativeResult createCalendarEvent(CalendarEventInput input) throws DeviceActionException;

    NativeResult createReminder(ReminderInput input) throws DeviceActionException;

    /**
     * Hands the referenced payload to the platform share sheet.
     */
    NativeResult export(ExportInput input) throws DeviceActionException;
}
