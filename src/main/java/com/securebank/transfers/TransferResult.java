package com.securebank.transfers;

import com.securebank.common.Money;
import lombok.Value;

/**
 * Outcome of a successful transfer, deposit or reversal.
 */
@Value
public class TransferResult {
    String transactionId;
    TransactionStatus status;
    Money amount;

    public static TransferResult of(Transaction transaction) {
        return new TransferResult(transaction.getTransactionId(), transaction.getStatus(), transaction.getAmount());
    }
}
