package com.securebank.ledger;

import com.securebank.common.Money;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable ledger entry representing the effect of a transaction on one account.
 *
 * A completed transfer or reversal has one debit and one credit; a deposit has a single credit;
 * a failed transaction has none.
 *
 * Ledger entries are never updated or deleted - they are append-only.
 */
@Entity
@Table(name = "ledger_entries", indexes = {
    @Index(name = "idx_ledger_transaction_id", columnList = "transaction_id"),
    @Index(name = "idx_ledger_account_id", columnList = "account_id"),
    @Index(name = "idx_ledger_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
public class LedgerEntry {

    @Id
    private String entryId;

    /**
     * The transaction this entry belongs to.
     */
    @Column(name = "transaction_id", nullable = false, updatable = false)
    private String transactionId;

    /**
     * The account affected by this entry.
     */
    @Column(name = "account_id", nullable = false, updatable = false)
    private String accountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private EntryType entryType;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "amount", nullable = false, updatable = false))
    })
    private Money amount;

    /**
     * Timestamp when this entry was created.
     * Ledger entries are immutable and never updated.
     */
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public LedgerEntry(String transactionId, String accountId, EntryType entryType, Money amount, Instant createdAt) {
        this.entryId = UUID.randomUUID().toString();
        this.transactionId = transactionId;
        this.accountId = accountId;
        this.entryType = entryType;
        this.amount = amount;
        this.createdAt = createdAt;
    }

    public enum EntryType {
        DEBIT,
        CREDIT
    }
}
