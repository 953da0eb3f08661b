package com.securebank.transfers;

/**
 * Kinds of transaction recorded by the engine.
 */
public enum TransactionType {
    /**
     * Customer-initiated movement between two accounts.
     */
    TRANSFER,

    /**
     * Administrative funding of a single account.
     */
    DEPOSIT,

    /**
     * Compensating movement that undoes a completed transfer.
     */
    REVERSAL
}
