package com.zzf.simon.infrastructure;

/**
 * Request attribute and MDC key under which the authenticated uid travels.
 */
public final class CallerContext {
    public static final String UID_ATTRIBUTE = "simon.uid";
    public static final String MDC_KEY = "uid";

    private CallerContext() {
    }
}
