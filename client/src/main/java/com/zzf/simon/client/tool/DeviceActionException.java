package com.zzf.simon.client.tool;

/**
 * The device refused or failed a native action after permission was granted.
 */
public class DeviceActionException extends Exception {
    public DeviceActionException(String message) {
        super(message);
    }

    public DeviceActionException(String message, Throwable cause) {
        super(message, cause);
    }
}
