package com.securebank.api.dto;

import com.securebank.transfers.TransactionStatus;
import com.securebank.transfers.TransferResult;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class TransferResponse {
    String transactionId;
    TransactionStatus status;
    BigDecimal amount;

    public static TransferResponse from(TransferResult result) {
        return new TransferResponse(result.getTransactionId(), result.getStatus(), result.getAmount().getAmount());
    }
}
