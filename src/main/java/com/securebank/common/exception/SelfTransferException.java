package com.securebank.common.exception;

/**
 * Thrown when the source and destination of a transfer are the same account.
 */
public class SelfTransferException extends TransferDeclinedException {

    public SelfTransferException() {
        super("SELF_TRANSFER", "Cannot transfer to the same account");
    }
}
