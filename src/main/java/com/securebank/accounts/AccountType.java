package com.securebank.accounts;

/**
 * Kinds of deposit account a customer can open. A customer holds at most one active account
 * of each type.
 */
public enum AccountType {
    CHECKING,
    SAVINGS
}
