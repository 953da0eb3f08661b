package com.securebank.ratelimit;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Result of a rate-limit check.
 */
@Value
public class RateLimitDecision {
    boolean allowed;
    long limit;
    long remaining;

    /**
     * Seconds until the window admits another request; zero when allowed.
     */
    long retryAfterSeconds;

    public static RateLimitDecision allowed(long limit, long remaining) {
        return new RateLimitDecision(true, limit, remaining, 0);
    }

    public static RateLimitDecision denied(long limit, long retryAfterSeconds) {
        return new RateLimitDecision(false, limit, 0, Math.max(1, retryAfterSeconds));
    }

    public static RateLimitDecision exempt() {
        return new RateLimitDecision(true, -1, -1, 0);
    }

    static long ceilSeconds(long nanos) {
        long perSecond = TimeUnit.SECONDS.toNanos(1);
        return Math.max(1, (nanos + perSecond - 1) / perSecond);
    }

    static long secondsUntil(Instant now, Instant then) {
        return ceilSeconds(Duration.between(now, then).toNanos());
    }
}
