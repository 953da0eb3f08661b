package com.securebank.ratelimit;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.EstimationProbe;
import io.github.bucket4j.TimeMeter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Per-process store holding one Bucket4j bucket per key. Counters are not shared between instances.
 *
 * Each bucket holds {@code limit} tokens and is refilled in full once per window, counted from
 * the key's first request, so the retry-after hint is the time left until that window resets.
 */
@Component
@ConditionalOnProperty(name = "secure-bank.rate-limit.store", havingValue = "memory")
@Slf4j
public class InMemoryRateLimitStore implements RateLimitStore {

    private final Map<String, KeyedBucket> buckets = new ConcurrentHashMap<>();
    private final Clock clock;
    private final TimeMeter timeMeter;

    public InMemoryRateLimitStore(Clock clock) {
        this.clock = clock;
        this.timeMeter = new ClockTimeMeter(clock);
    }

    @Override
    public RateLimitDecision tryAcquire(String bucketKey, int limit, Duration window) {
        KeyedBucket keyed = buckets.computeIfAbsent(bucketKey, k -> new KeyedBucket(newBucket(limit, window)));
        keyed.touch(clock.instant());

        ConsumptionProbe consumption = keyed.bucket.tryConsumeAndReturnRemaining(1);
        if (consumption.isConsumed()) {
            return RateLimitDecision.allowed(limit, consumption.getRemainingTokens());
        }
        return RateLimitDecision.denied(limit, RateLimitDecision.ceilSeconds(consumption.getNanosToWaitForRefill()));
    }

    @Override
    public RateLimitDecision check(String bucketKey, int limit, Duration window) {
        KeyedBucket keyed = buckets.get(bucketKey);
        if (keyed == null) {
            return RateLimitDecision.allowed(limit, limit);
        }
        EstimationProbe estimate = keyed.bucket.estimateAbilityToConsume(1);
        if (estimate.canBeConsumed()) {
            return RateLimitDecision.allowed(limit, estimate.getRemainingTokens());
        }
        return RateLimitDecision.denied(limit, RateLimitDecision.ceilSeconds(estimate.getNanosToWaitForRefill()));
    }

    /**
     * A key idle for a whole window has been refilled, so dropping it changes no decision.
     */
    @Override
    public void purgeBefore(Instant cutoff) {
        int before = buckets.size();
        buckets.values().removeIf(keyed -> keyed.lastUsed.isBefore(cutoff));
        log.debug("Purged {} idle rate-limit buckets", before - buckets.size());
    }

    @Override
    public String getStoreName() {
        return "memory";
    }

    private Bucket newBucket(int limit, Duration window) {
        Bandwidth bandwidth = Bandwidth.builder()
            .capacity(limit)
            .refillIntervally(limit, window)
            .build();
        return Bucket.builder()
            .addLimit(bandwidth)
            .withCustomTimePrecision(timeMeter)
            .build();
    }

    private static final class KeyedBucket {
        private final Bucket bucket;
        private volatile Instant lastUsed = Instant.MIN;

        KeyedBucket(Bucket bucket) {
            this.bucket = bucket;
        }

        void touch(Instant now) {
            lastUsed = now;
        }
    }

    /**
     * Bucket time follows the injected clock, so windows move with it.
     */
    private static final class ClockTimeMeter implements TimeMeter {
        private final Clock clock;

        ClockTimeMeter(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long currentTimeNanos() {
            Instant now = clock.instant();
            return TimeUnit.SECONDS.toNanos(now.getEpochSecond()) + now.getNano();
        }

        @Override
        public boolean isWallClockBased() {
            return true;
        }
    }
}
