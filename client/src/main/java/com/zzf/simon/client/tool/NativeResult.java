package com.zzf.simon.client.tool;

import lombok.Value;

/**
 * Identifier the OS assigned to a scheduled notification, calendar event or reminder.
 */
@Value
public class NativeResult {
    String nativeId;
    String nativeStatus;
}
