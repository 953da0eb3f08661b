package com.securebank.accounts;

/**
 * Operational status of an account. Disabled accounts can neither send nor receive funds.
 */
public enum AccountStatus {
    ACTIVE,
    DISABLED
}
