package com.securebank.ratelimit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Sliding-log store kept in the application database, so all instances share the counters.
 *
 * Count and insert are not isolated from each other; concurrent requests at the edge of a
 * window may be admitted slightly over the limit.
 */
@Component
@ConditionalOnProperty(name = "secure-bank.rate-limit.store", havingValue = "jdbc")
@RequiredArgsConstructor
@Slf4j
public class JdbcRateLimitStore implements RateLimitStore {

    private final RateLimitHitRepository hitRepository;
    private final Clock clock;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public RateLimitDecision tryAcquire(String bucketKey, int limit, Duration window) {
        Instant now = clock.instant();
        RateLimitDecision decision = evaluate(bucketKey, limit, window, now);
        if (!decision.isAllowed()) {
            return decision;
        }
        hitRepository.save(new RateLimitHit(bucketKey, now));
        return RateLimitDecision.allowed(limit, decision.getRemaining() - 1);
    }

    @Override
    @Transactional(readOnly = true)
    public RateLimitDecision check(String bucketKey, int limit, Duration window) {
        return evaluate(bucketKey, limit, window, clock.instant());
    }

    @Override
    @Transactional
    public void purgeBefore(Instant cutoff) {
        int deleted = hitRepository.deleteOlderThan(cutoff);
        log.debug("Purged {} rate-limit hits older than {}", deleted, cutoff);
    }

    @Override
    public String getStoreName() {
        return "jdbc";
    }

    private RateLimitDecision evaluate(String bucketKey, int limit, Duration window, Instant now) {
        Instant cutoff = now.minus(window);
        long count = hitRepository.countByBucketKeyAndHitAtAfter(bucketKey, cutoff);
        if (count < limit) {
            return RateLimitDecision.allowed(limit, limit - count);
        }
        long retryAfter = hitRepository.findFirstByBucketKeyAndHitAtAfterOrderByHitAtAsc(bucketKey, cutoff)
            .map(oldest -> RateLimitDecision.secondsUntil(now, oldest.getHitAt().plus(window)))
            .orElse(1L);
        return RateLimitDecision.denied(limit, retryAfter);
    }
}
