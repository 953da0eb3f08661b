package com.securebank.lockout;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Lock state of one identity at a point in time, derived from its attempt log.
 */
@Value
public class LockoutState {
    int failureCount;
    Instant lockedUntil;

    public static LockoutState unlocked(int failureCount) {
        return new LockoutState(failureCount, null);
    }

    public boolean isLockedAt(Instant now) {
        return lockedUntil != null && now.isBefore(lockedUntil);
    }

    /**
     * Whole seconds until the lock lifts, rounded up; zero when not locked.
     */
    public long remainingSecondsAt(Instant now) {
        if (!isLockedAt(now)) {
            return 0;
        }
        long millis = Duration.between(now, lockedUntil).toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }
}
