package com.securebank.common.exception;

/**
 * Thrown when a transaction is not found.
 */
public class TransactionNotFoundException extends SecureBankException {

    public TransactionNotFoundException(String transactionId) {
        super("NOT_FOUND", "Transaction not found: " + transactionId);
    }
}
