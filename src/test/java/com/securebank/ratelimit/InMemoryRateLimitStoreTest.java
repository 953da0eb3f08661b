package com.securebank.ratelimit;

import com.securebank.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the per-process bucket store.
 */
class InMemoryRateLimitStoreTest {

    private static final Duration MINUTE = Duration.ofMinutes(1);

    private final Instant start = Instant.parse("2024-05-01T10:00:00Z");
    private final MutableClock clock = new MutableClock(start);
    private final InMemoryRateLimitStore store = new InMemoryRateLimitStore(clock);

    @Test
    void testAdmitsUpToLimitThenDenies() {
        for (int i = 0; i < 5; i++) {
            clock.set(start.plusSeconds(i));
            RateLimitDecision decision = store.tryAcquire("ip:1", 5, MINUTE);
            assertTrue(decision.isAllowed());
            assertEquals(4 - i, decision.getRemaining());
        }

        clock.set(start.plusSeconds(10));
        RateLimitDecision denied = store.tryAcquire("ip:1", 5, MINUTE);

        assertFalse(denied.isAllowed());
        assertEquals(5, denied.getLimit());
        assertEquals(0, denied.getRemaining());
        assertEquals(50, denied.getRetryAfterSeconds());
    }

    @Test
    void testWindowResetsOneWindowAfterFirstRequest() {
        for (int i = 0; i < 5; i++) {
            clock.set(start.plusSeconds(i * 10L));
            store.tryAcquire("ip:1", 5, MINUTE);
        }
        clock.set(start.plusSeconds(59));
        assertFalse(store.tryAcquire("ip:1", 5, MINUTE).isAllowed());

        clock.set(start.plusSeconds(60));
        RateLimitDecision afterReset = store.tryAcquire("ip:1", 5, MINUTE);

        assertTrue(afterReset.isAllowed());
        assertEquals(4, afterReset.getRemaining());
    }

    @Test
    void testDeniedRequestsDoNotExtendTheWindow() {
        for (int i = 0; i < 3; i++) {
            store.tryAcquire("ip:1", 3, MINUTE);
        }
        for (int i = 1; i <= 30; i++) {
            clock.set(start.plusSeconds(i));
            assertFalse(store.tryAcquire("ip:1", 3, MINUTE).isAllowed());
        }

        clock.set(start.plus(MINUTE));
        assertTrue(store.tryAcquire("ip:1", 3, MINUTE).isAllowed());
    }

    @Test
    void testKeysAreIndependent() {
        store.tryAcquire("ip:1", 1, MINUTE);

        assertFalse(store.tryAcquire("ip:1", 1, MINUTE).isAllowed());
        assertTrue(store.tryAcquire("ip:2", 1, MINUTE).isAllowed());
    }

    @Test
    void testRetryAfterIsAtLeastOneSecond() {
        store.tryAcquire("ip:1", 1, MINUTE);

        clock.set(start.plus(MINUTE).minusMillis(1));
        RateLimitDecision denied = store.tryAcquire("ip:1", 1, MINUTE);

        assertEquals(1, denied.getRetryAfterSeconds());
    }

    @Test
    void testCheckDoesNotConsume() {
        assertTrue(store.check("ip:1", 2, MINUTE).isAllowed());
        store.tryAcquire("ip:1", 2, MINUTE);

        for (int i = 0; i < 5; i++) {
            RateLimitDecision checked = store.check("ip:1", 2, MINUTE);
            assertTrue(checked.isAllowed());
            assertEquals(1, checked.getRemaining());
        }
        store.tryAcquire("ip:1", 2, MINUTE);

        RateLimitDecision exhausted = store.check("ip:1", 2, MINUTE);
        assertFalse(exhausted.isAllowed());
        assertEquals(60, exhausted.getRetryAfterSeconds());
    }

    @Test
    void testPurgeDropsOnlyIdleBuckets() {
        store.tryAcquire("ip:1", 1, MINUTE);

        store.purgeBefore(start);
        assertFalse(store.tryAcquire("ip:1", 1, MINUTE).isAllowed());

        store.purgeBefore(start.plusMillis(1));
        assertTrue(store.tryAcquire("ip:1", 1, MINUTE).isAllowed());
    }
}
