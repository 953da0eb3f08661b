package com.securebank.lockout;

import lombok.Value;

/**
 * Result of recording a login attempt.
 *
 * {@code allowed} is true only for a successful attempt against an unlocked account.
 * {@code remainingLockSeconds} is positive whenever the account is locked after the attempt.
 */
@Value
public class LockoutDecision {
    boolean allowed;
    long remainingLockSeconds;
    int failureCount;

    /**
     * The account was already locked when the attempt arrived.
     */
    boolean blocked;
}
