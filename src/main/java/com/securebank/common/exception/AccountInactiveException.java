package com.securebank.common.exception;

/**
 * Thrown when a transfer touches a disabled account.
 */
public class AccountInactiveException extends TransferDeclinedException {

    public AccountInactiveException(String accountId) {
        super("ACCOUNT_INACTIVE", "Account is not active: " + accountId);
    }
}
