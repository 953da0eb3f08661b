package com.securebank.transfers;

/**
 * Resulting status of a transaction. Set once when the record is written.
 */
public enum TransactionStatus {
    COMPLETED,

    /**
     * Declined after the accounts were resolved; no balance changed.
     */
    FAILED,

    /**
     * Carried by the compensating record of a reversal.
     */
    REVERSED
}
