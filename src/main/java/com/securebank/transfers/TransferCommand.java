package com.securebank.transfers;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A customer's request to move funds from one of their accounts to another account number.
 */
@Value
@Builder
public class TransferCommand {
    String initiatorUserId;
    String sourceAccountId;
    String destinationAccountNumber;
    BigDecimal amount;
    String description;
    String sourceIp;
    String userAgent;
}
