package com.zzf.simon.tool;

import com.zzf.simon.config.SimonProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token bucket per uid and tool. Buckets refill continuously at {@code capacity / window}.
 */
@Component
public class ToolRateLimiter {
    private final int capacity;
    private final long windowMillis;
    private final Clock clock;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    @Autowired
    public ToolRateLimiter(SimonProperties properties) {
        this(properties.getTools().getRateLimit().getCapacity(), properties.getTools().getRateLimit().getWindow(), Clock.systemUTC());
    }

    ToolRateLimiter(int capacity, Duration window, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.windowMillis = Math.max(1, window.toMillis());
        this.clock = clock;
    }

    /**
     * @return 0 when the call is admitted, otherwise the seconds until a token is available
     */
    public long acquire(String uid, String toolId) {
        Bucket bucket = buckets.computeIfAbsent(uid + "|" + toolId, k -> new Bucket(capacity, clock.millis()));
        synchronized (bucket) {
            long now = clock.millis();
            double perMilli = (double) capacity / windowMillis;
            bucket.tokens = Math.min(capacity, bucket.tokens + (now - bucket.refilledAt) * perMilli);
            bucket.refilledAt = now;
            if (bucket.tokens >= 1.0) {
                bucket.tokens -= 1.0;
                return 0;
            }
            double missingMillis = (1.0 - bucket.tokens) / perMilli;
            return Math.max(1, (long) Math.ceil(missingMillis / 1000.0));
        }
    }

    private static final class Bucket {
        private double tokens;
        private long refilledAt;

        private Bucket(double tokens, long refilledAt) {
            this.tokens = tokens;
            this.refilledAt = refilledAt;
        }
    }
}
