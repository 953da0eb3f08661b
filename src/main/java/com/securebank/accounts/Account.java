package com.securebank.accounts;

import com.securebank.common.Money;
import com.securebank.common.exception.InsufficientFundsException;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A customer deposit account.
 *
 * The balance never goes negative and only changes through {@link #debit} and {@link #credit},
 * which the transaction engine calls while holding the row lock.
 */
@Entity
@Table(name = "accounts", indexes = {
    @Index(name = "idx_accounts_number", columnList = "account_number", unique = true),
    @Index(name = "idx_accounts_owner", columnList = "owner_id")
})
@Data
@NoArgsConstructor
public class Account {

    @Id
    private String accountId;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private String ownerId;

    @Column(name = "account_number", nullable = false, unique = true, updatable = false, length = 10)
    private String accountNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", nullable = false, updatable = false)
    private AccountType accountType;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "balance", nullable = false, precision = 17, scale = 2))
    })
    private Money balance;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AccountStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Account(String ownerId, String accountNumber, AccountType accountType, Instant now) {
        this.accountId = UUID.randomUUID().toString();
        this.ownerId = ownerId;
        this.accountNumber = accountNumber;
        this.accountType = accountType;
        this.balance = Money.zero();
        this.status = AccountStatus.ACTIVE;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public boolean isActive() {
        return status == AccountStatus.ACTIVE;
    }

    public void debit(Money amount, Instant now) {
        requirePositive(amount);
        if (balance.isLessThan(amount)) {
            throw new InsufficientFundsException(accountId, amount);
        }
        this.balance = balance.subtract(amount);
        this.updatedAt = now;
    }

    public void credit(Money amount, Instant now) {
        requirePositive(amount);
        this.balance = balance.add(amount);
        this.updatedAt = now;
    }

    public void changeStatus(AccountStatus status, Instant now) {
        this.status = status;
        this.updatedAt = now;
    }

    private static void requirePositive(Money amount) {
        if (amount == null || !amount.isPositive()) {
            throw new IllegalArgumentException("Amount must be positive");
        }
    }
}
