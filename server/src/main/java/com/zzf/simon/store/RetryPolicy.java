package com.zzf.simon.store;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Exponential backoff for transient store failures. Non-transient failures are rethrown on the first attempt.
 */
@Slf4j
public class RetryPolicy {

    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final long initialDelayMs;
    private final long maxDelayMs;
    private final double backoffFactor;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, double backoffFactor) {
        this(maxAttempts, initialDelay, maxDelay, backoffFactor, Thread::sleep);
    }

    public RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, double backoffFactor, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialDelayMs = initialDelay.toMillis();
        this.maxDelayMs = maxDelay.toMillis();
        this.backoffFactor = backoffFactor;
        this.sleeper = sleeper;
    }

    /**
     * Delay before retry number {@code attempt} (1-based).
     */
    public long getDelay(int attempt) {
        return (long) Math.min(initialDelayMs * Math.pow(backoffFactor, attempt - 1), maxDelayMs);
    }

    public <T> T execute(String operation, Supplier<T> action) {
        StoreException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                long delay = getDelay(attempt - 1);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new StoreException(StoreErrorCode.ABORTED, operation + " interrupted during backoff", e);
                }
            }
            try {
                return action.get();
            } catch (StoreException e) {
                if (!e.isTransient()) {
                    throw e;
                }
                last = e;
                log.warn("store.retry op={} attempt={}/{} code={} msg={}", operation, attempt, maxAttempts, e.getCode(), e.getMessage());
            }
        }
        throw last;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
