package com.securebank.common.exception;

import com.securebank.accounts.AccountType;

/**
 * Thrown when a user tries to open a second active account of the same type.
 */
public class AccountTypeAlreadyOpenException extends SecureBankException {

    public AccountTypeAlreadyOpenException(AccountType accountType) {
        super("ACCOUNT_TYPE_ALREADY_OPEN", "An active " + accountType + " account already exists");
    }
}
