package com.zzf.simon.tool;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ToolRateLimiterTest {

    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2026-01-01T00:00:00Z");

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }
    }

    @Test
    void shouldAdmitUpToCapacityThenAskToWait() {
        MutableClock clock = new MutableClock();
        ToolRateLimiter limiter = new ToolRateLimiter(2, Duration.ofMinutes(1), clock);

        assertEquals(0, limiter.acquire("alice", "reminder_create"));
        assertEquals(0, limiter.acquire("alice", "reminder_create"));
        long retryAfter = limiter.acquire("alice", "reminder_create");

        assertTrue(retryAfter >= 30 && retryAfter <= 31, String.valueOf(retryAfter));
    }

    @Test
    void shouldRefillOverTime() {
        MutableClock clock = new MutableClock();
        ToolRateLimiter limiter = new ToolRateLimiter(1, Duration.ofSeconds(10), clock);

        assertEquals(0, limiter.acquire("alice", "memory_read"));
        assertTrue(limiter.acquire("alice", "memory_read") > 0);
        clock.advance(Duration.ofSeconds(10));

        assertEquals(0, limiter.acquire("alice", "memory_read"));
    }

    @Test
    void shouldKeepBucketsPerUserAndTool() {
        ToolRateLimiter limiter = new ToolRateLimiter(1, Duration.ofMinutes(1), new MutableClock());

        assertEquals(0, limiter.acquire("alice", "memory_read"));
        assertEquals(0, limiter.acquire("bob", "memory_read"));
        assertEquals(0, limiter.acquire("alice", "memory_write"));
        assertTrue(limiter.acquire("alice", "memory_read") > 0);
    }
}
