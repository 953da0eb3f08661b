package com.securebank.common.exception;

/**
 * Base class for typed transfer failures.
 *
 * When the engine persisted a FAILED transaction record for the attempt, its id is
 * available through {@link #getTransactionId()}; otherwise nothing was recorded.
 */
public abstract class TransferDeclinedException extends SecureBankException {

    private String transactionId;

    protected TransferDeclinedException(String errorCode, String message) {
        super(errorCode, message);
    }

    public String getTransactionId() {
        return transactionId;
    }

    public TransferDeclinedException withTransactionId(String transactionId) {
        this.transactionId = transactionId;
        return this;
    }
}
