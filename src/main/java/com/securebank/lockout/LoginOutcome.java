package com.securebank.lockout;

/**
 * Outcome recorded for a login attempt.
 */
public enum LoginOutcome {
    /**
     * Credentials verified; clears the failure counter.
     */
    SUCCESS,

    /**
     * Credentials rejected; counts toward a lock.
     */
    FAILURE,

    /**
     * Rejected because the account was locked. Does not count toward a new lock.
     */
    BLOCKED,

    /**
     * Administrative unlock; clears the failure counter and any active lock.
     */
    RESET
}
