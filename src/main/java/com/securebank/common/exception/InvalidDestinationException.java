package com.securebank.common.exception;

/**
 * Thrown when the destination account number is malformed or unknown.
 */
public class InvalidDestinationException extends TransferDeclinedException {

    public InvalidDestinationException() {
        super("INVALID_DESTINATION", "Destination account is invalid");
    }
}
