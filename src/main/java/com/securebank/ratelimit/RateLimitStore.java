package com.securebank.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Backing store for per-key request windows.
 *
 * Selected with {@code secure-bank.rate-limit.store}:
 * <ul>
 *   <li>{@code memory} - per-process Bucket4j buckets, for single-instance deployments</li>
 *   <li>{@code jdbc} - shared through the application database, for multi-instance deployments</li>
 * </ul>
 */
public interface RateLimitStore {

    /**
     * Consume one request for {@code bucketKey} if its window still has capacity.
     *
     * @return allowed with remaining capacity, or denied with the seconds until the window admits
     *         another request
     */
    RateLimitDecision tryAcquire(String bucketKey, int limit, Duration window);

    /**
     * Same answer as {@link #tryAcquire} without consuming anything.
     */
    RateLimitDecision check(String bucketKey, int limit, Duration window);

    /**
     * Drop state for keys not used since {@code cutoff}.
     */
    void purgeBefore(Instant cutoff);

    /**
     * Short name used in logs.
     */
    String getStoreName();
}
