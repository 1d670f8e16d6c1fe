package com.zzf.simon.store;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final List<Long> sleeps = new ArrayList<>();
    private final RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(5), 2.0, sleeps::add);

    @Test
    void shouldGrowDelayExponentiallyAndCap() {
        assertEquals(100, policy.getDelay(1));
        assertEquals(200, policy.getDelay(2));
        assertEquals(400, policy.getDelay(3));
        assertEquals(5000, policy.getDelay(20));
    }

    @Test
    void shouldRetryTransientFailuresUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = policy.execute("get", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new StoreException(StoreErrorCode.UNAVAILABLE, "down");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(100L, 200L), sleeps);
    }

    @Test
    void shouldGiveUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        StoreException e = assertThrows(StoreException.class, () -> policy.execute("put", () -> {
            calls.incrementAndGet();
            throw new StoreException(StoreErrorCode.DEADLINE_EXCEEDED, "slow");
        }));

        assertEquals(StoreErrorCode.DEADLINE_EXCEEDED, e.getCode());
        assertEquals(3, calls.get());
    }

    @Test
    void shouldNotRetryPermanentFailures() {
        for (StoreErrorCode code : new StoreErrorCode[]{StoreErrorCode.NOT_FOUND, StoreErrorCode.PERMISSION_DENIED, StoreErrorCode.INVALID_ARGUMENT}) {
            AtomicInteger calls = new AtomicInteger();
            assertThrows(StoreException.class, () -> policy.execute("get", () -> {
                calls.incrementAndGet();
                throw new StoreException(code, "no");
            }));
            assertEquals(1, calls.get(), code.name());
        }
        assertTrue(sleeps.isEmpty());
    }
}
