package com.securebank.common.exception;

/**
 * Thrown when a transfer amount is not positive, has more than two decimals or exceeds the ceiling.
 */
public class InvalidAmountException extends TransferDeclinedException {

    public InvalidAmountException(String reason) {
        super("INVALID_AMOUNT", "Invalid amount: " + reason);
    }
}
