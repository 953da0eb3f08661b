package com.securebank.common.exception;

import com.securebank.common.Money;

/**
 * Thrown when an account has insufficient funds for a transaction.
 */
public class InsufficientFundsException extends TransferDeclinedException {

    public InsufficientFundsException(String accountId, Money required) {
        super("INSUFFICIENT_FUNDS",
            String.format("Insufficient funds in account %s for amount %s", accountId, required));
    }
}
