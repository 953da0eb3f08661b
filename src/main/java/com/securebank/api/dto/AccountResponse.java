package com.securebank.api.dto;

import com.securebank.accounts.Account;
import com.securebank.accounts.AccountStatus;
import com.securebank.accounts.AccountType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
public class AccountResponse {
    String accountId;
    String ownerId;
    String accountNumber;
    AccountType accountType;
    BigDecimal balance;
    AccountStatus status;
    Instant createdAt;

    public static AccountResponse from(Account account) {
        return new AccountResponse(account.getAccountId(), account.getOwnerId(), account.getAccountNumber(),
            account.getAccountType(), account.getBalance().getAmount(), account.getStatus(), account.getCreatedAt());
    }
}
