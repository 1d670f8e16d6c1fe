package com.zzf.simon.client.tool;

public enum DevicePermission {
    NOTIFICATIONS,
    CALENDAR,
    REMINDERS
}
