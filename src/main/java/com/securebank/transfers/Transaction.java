package com.securebank.transfers;

import com.securebank.common.Money;
import com.securebank.crypto.EncryptedStringConverter;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of a transfer, deposit or reversal.
 *
 * Records are written once and never modified; a reversal is a new record pointing at the
 * original through {@code reversalOf}. The description and counterparty account number are
 * encrypted at rest.
 */
@Entity
@Table(name = "transactions", indexes = {
    @Index(name = "idx_transactions_source", columnList = "source_account_id"),
    @Index(name = "idx_transactions_destination", columnList = "destination_account_id"),
    @Index(name = "idx_transactions_created_at", columnList = "created_at")
})
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Transaction {

    @Id
    private String transactionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private TransactionType transactionType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private TransactionStatus status;

    @Column(name = "source_account_id", updatable = false)
    private String sourceAccountId;

    @Column(name = "destination_account_id", nullable = false, updatable = false)
    private String destinationAccountId;

    @ToString.Exclude
    @Convert(converter = EncryptedStringConverter.class)
    @Column(updatable = false, length = 128)
    private String counterpartyAccountNumber;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "amount", nullable = false, updatable = false))
    })
    private Money amount;

    @ToString.Exclude
    @Convert(converter = EncryptedStringConverter.class)
    @Column(updatable = false, length = 1024)
    private String description;

    @Column(updatable = false)
    private String failureReason;

    @Column(name = "reversal_of", unique = true, updatable = false)
    private String reversalOf;

    @Column(nullable = false, updatable = false)
    private String initiatedBy;

    @Column(length = 45, updatable = false)
    private String sourceIp;

    @Column(updatable = false)
    private String userAgent;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    private Transaction(TransactionType type, TransactionStatus status, String sourceAccountId,
                        String destinationAccountId, String counterpartyAccountNumber, Money amount,
                        String description, String initiatedBy, String sourceIp, String userAgent, Instant now) {
        this.transactionId = UUID.randomUUID().toString();
        this.transactionType = type;
        this.status = status;
        this.sourceAccountId = sourceAccountId;
        this.destinationAccountId = destinationAccountId;
        this.counterpartyAccountNumber = counterpartyAccountNumber;
        this.amount = amount;
        this.description = description;
        this.initiatedBy = initiatedBy;
        this.sourceIp = sourceIp;
        this.userAgent = truncate(userAgent, 255);
        this.createdAt = now;
    }

    public static Transaction completedTransfer(TransferCommand command, String destinationAccountId,
                                                Money amount, Instant now) {
        return new Transaction(TransactionType.TRANSFER, TransactionStatus.COMPLETED,
            command.getSourceAccountId(), destinationAccountId, command.getDestinationAccountNumber(),
            amount, command.getDescription(), command.getInitiatorUserId(),
            command.getSourceIp(), command.getUserAgent(), now);
    }

    public static Transaction failedTransfer(TransferCommand command, String destinationAccountId,
                                             Money amount, String failureReason, Instant now) {
        Transaction failed = new Transaction(TransactionType.TRANSFER, TransactionStatus.FAILED,
            command.getSourceAccountId(), destinationAccountId, command.getDestinationAccountNumber(),
            amount, command.getDescription(), command.getInitiatorUserId(),
            command.getSourceIp(), command.getUserAgent(), now);
        failed.failureReason = failureReason;
        return failed;
    }

    public static Transaction deposit(String accountId, Money amount, String description,
                                      String adminUserId, String sourceIp, String userAgent, Instant now) {
        return new Transaction(TransactionType.DEPOSIT, TransactionStatus.COMPLETED,
            null, accountId, null, amount, description, adminUserId, sourceIp, userAgent, now);
    }

    /**
     * Compensating record for {@code original}: moves the amount from the original destination
     * back to the original source.
     */
    public static Transaction reversalOf(Transaction original, String originalSourceAccountNumber,
                                         String reason, String adminUserId, String sourceIp,
                                         String userAgent, Instant now) {
        Transaction reversal = new Transaction(TransactionType.REVERSAL, TransactionStatus.REVERSED,
            original.getDestinationAccountId(), original.getSourceAccountId(), originalSourceAccountNumber,
            original.getAmount(), reason, adminUserId, sourceIp, userAgent, now);
        reversal.reversalOf = original.getTransactionId();
        return reversal;
    }

    public boolean isCompleted() {
        return status == TransactionStatus.COMPLETED;
    }

    private static String truncate(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }
}
