package com.zzf.simon.pipeline;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Coaching route for one user turn. Decides which context is loaded and whether the planner runs.
 */
public enum Route {
    QUICK_NUDGE(false, EnumSet.of(ContextKey.PREFERENCES)),
    DEEP_SESSION(true, EnumSet.of(ContextKey.PREFERENCES, ContextKey.ACTIVE_PLANS)),
    MAKE_A_SYSTEM(true, EnumSet.of(ContextKey.PREFERENCES, ContextKey.ACTIVE_PLANS)),
    REVIEW_RETRO(true, EnumSet.of(ContextKey.ACTIVE_PLANS, ContextKey.COMMITMENTS)),
    SCHEDULING(false, EnumSet.of(ContextKey.ACTIVE_PLANS));

    public enum ContextKey {
        PREFERENCES,
        ACTIVE_PLANS,
        COMMITMENTS
    }

    private final boolean needsPlanner;
    private final Set<ContextKey> contextKeys;

    Route(boolean needsPlanner, Set<ContextKey> contextKeys) {
        this.needsPlanner = needsPlanner;
        this.contextKeys = contextKeys;
    }

    public boolean needsPlanner() {
        return needsPlanner;
    }

    public boolean wants(ContextKey key) {
        return contextKeys.contains(key);
    }

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Route> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(r -> r.wire().equals(normalized)).findFirst();
    }
}
