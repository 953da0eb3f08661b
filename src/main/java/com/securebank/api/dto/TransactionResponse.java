package com.securebank.api.dto;

import com.securebank.transfers.Transaction;
import com.securebank.transfers.TransactionStatus;
import com.securebank.transfers.TransactionType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
public class TransactionResponse {
    String transactionId;
    TransactionType transactionType;
    TransactionStatus status;
    String sourceAccountId;
    String destinationAccountId;
    String counterpartyAccountNumber;
    BigDecimal amount;
    String description;
    String failureReason;
    String reversalOf;
    Instant createdAt;

    public static TransactionResponse from(Transaction t) {
        return new TransactionResponse(t.getTransactionId(), t.getTransactionType(), t.getStatus(),
            t.getSourceAccountId(), t.getDestinationAccountId(), t.getCounterpartyAccountNumber(),
            t.getAmount().getAmount(), t.getDescription(), t.getFailureReason(), t.getReversalOf(),
            t.getCreatedAt());
    }
}
