package com.securebank.common.exception;

/**
 * Thrown when an account is not found or is not visible to the caller.
 */
public class AccountNotFoundException extends SecureBankException {

    public AccountNotFoundException(String accountId) {
        super("NOT_FOUND", "Account not found: " + accountId);
    }
}
