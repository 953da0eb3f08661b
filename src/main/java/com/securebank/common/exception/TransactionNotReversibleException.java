package com.securebank.common.exception;

/**
 * Thrown when a reversal targets something other than a completed, not yet reversed transfer.
 */
public class TransactionNotReversibleException extends SecureBankException {

    public TransactionNotReversibleException(String transactionId, String reason) {
        super("NOT_REVERSIBLE", "Transaction " + transactionId + " cannot be reversed: " + reason);
    }
}
