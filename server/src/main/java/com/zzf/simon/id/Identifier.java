package com.zzf.simon.id;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prefixed identifiers for stored documents.
 */
public final class Identifier {

    private static final AtomicLong counter = new AtomicLong(System.currentTimeMillis());

    private Identifier() {
    }

    /**
     * Increasing within one process, used where creation order matters (messages).
     */
    public static String ascending(String prefix) {
        return prefix + "_" + counter.incrementAndGet();
    }

    public static String random(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
