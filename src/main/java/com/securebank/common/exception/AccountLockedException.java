package com.securebank.common.exception;

/**
 * Thrown when a login is attempted while the account is temporarily locked.
 */
public class AccountLockedException extends SecureBankException {

    private final long remainingLockSeconds;

    public AccountLockedException(long remainingLockSeconds) {
        super("ACCOUNT_LOCKED",
            String.format("Account is temporarily locked. Try again in %d seconds", remainingLockSeconds));
        this.remainingLockSeconds = remainingLockSeconds;
    }

    public long getRemainingLockSeconds() {
        return remainingLockSeconds;
    }
}
