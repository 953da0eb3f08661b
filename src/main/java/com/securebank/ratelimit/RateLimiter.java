package com.securebank.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Multi-tier rate limiting.
 *
 * Every request counts against the global tier; authentication routes additionally count
 * against the stricter authentication tier. A request rejected by either tier consumes nothing
 * from the other.
 */
@Service
@Slf4j
public class RateLimiter {

    private static final String GLOBAL_PREFIX = "global:";
    private static final String AUTH_PREFIX = "auth:";

    private final RateLimitStore store;
    private final Clock clock;
    private final int globalLimit;
    private final Duration globalWindow;
    private final int authLimit;
    private final Duration authWindow;

    public RateLimiter(ObjectProvider<RateLimitStore> storeProvider,
                       Clock clock,
                       @Value("${secure-bank.rate-limit.global.limit:100}") int globalLimit,
                       @Value("${secure-bank.rate-limit.global.window:1h}") Duration globalWindow,
                       @Value("${secure-bank.rate-limit.auth.limit:5}") int authLimit,
                       @Value("${secure-bank.rate-limit.auth.window:1m}") Duration authWindow) {
        RateLimitStore configured = storeProvider.getIfAvailable();
        if (configured == null) {
            throw new IllegalStateException(
                "secure-bank.rate-limit.store must be set to 'memory' (single instance) or 'jdbc' (shared)");
        }
        if (globalLimit < 1 || authLimit < 1) {
            throw new IllegalArgumentException("Rate limits must be at least 1");
        }
        this.store = configured;
        this.clock = clock;
        this.globalLimit = globalLimit;
        this.globalWindow = globalWindow;
        this.authLimit = authLimit;
        this.authWindow = authWindow;
        log.info("Rate limiter using {} store: global {}/{}, authentication {}/{}",
            store.getStoreName(), globalLimit, globalWindow, authLimit, authWindow);
    }

    /**
     * Record a request by {@code identity} on a route of class {@code routeClass}.
     *
     * @return the decision of the first tier that rejects, or the tightest remaining capacity
     */
    public RateLimitDecision allow(String identity, RouteClass routeClass) {
        String globalKey = GLOBAL_PREFIX + identity;

        RateLimitDecision authDecision = null;
        if (routeClass == RouteClass.AUTHENTICATION) {
            RateLimitDecision globalCheck = store.check(globalKey, globalLimit, globalWindow);
            if (!globalCheck.isAllowed()) {
                log.warn("Global rate limit hit by {}: retry in {}s", identity, globalCheck.getRetryAfterSeconds());
                return globalCheck;
            }
            authDecision = store.tryAcquire(AUTH_PREFIX + identity, authLimit, authWindow);
            if (!authDecision.isAllowed()) {
                log.warn("Authentication rate limit hit by {}: retry in {}s",
                    identity, authDecision.getRetryAfterSeconds());
                return authDecision;
            }
        }

        RateLimitDecision globalDecision = store.tryAcquire(globalKey, globalLimit, globalWindow);
        if (!globalDecision.isAllowed()) {
            log.warn("Global rate limit hit by {}: retry in {}s", identity, globalDecision.getRetryAfterSeconds());
            return globalDecision;
        }

        if (authDecision != null && authDecision.getRemaining() < globalDecision.getRemaining()) {
            return authDecision;
        }
        return globalDecision;
    }

    @Scheduled(fixedDelayString = "${secure-bank.rate-limit.purge-interval-ms:300000}")
    public void purgeExpired() {
        Duration longest = globalWindow.compareTo(authWindow) >= 0 ? globalWindow : authWindow;
        store.purgeBefore(clock.instant().minus(longest));
    }
}
