package com.securebank.ledger;

import com.securebank.common.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Service for managing the double-entry ledger.
 *
 * Every balance change in the bank is recorded as immutable ledger entries. Recording methods
 * must run inside the caller's transaction so that entries commit together with the balance
 * change they describe.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final LedgerRepository ledgerRepository;
    private final Clock clock;

    /**
     * Record a movement of funds between two accounts: debit the source, credit the destination.
     * Used for transfers and for reversals (with the original accounts swapped).
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void recordMovement(String transactionId, String debitAccountId, String creditAccountId, Money amount) {
        Instant now = clock.instant();
        LedgerEntry debit = new LedgerEntry(transactionId, debitAccountId, LedgerEntry.EntryType.DEBIT, amount, now);
        LedgerEntry credit = new LedgerEntry(transactionId, creditAccountId, LedgerEntry.EntryType.CREDIT, amount, now);
        ledgerRepository.save(debit);
        ledgerRepository.save(credit);

        log.debug("Recorded movement: txn={}, {} -> {}, amount={}",
            transactionId, debitAccountId, creditAccountId, amount);
    }

    /**
     * Record funds entering the bank into an account.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void recordDeposit(String transactionId, String accountId, Money amount) {
        ledgerRepository.save(
            new LedgerEntry(transactionId, accountId, LedgerEntry.EntryType.CREDIT, amount, clock.instant()));

        log.debug("Recorded deposit: txn={}, account={}, amount={}", transactionId, accountId, amount);
    }

    /**
     * Credits minus debits for an account. Always equal to the account balance.
     */
    @Transactional(readOnly = true)
    public Money getLedgerBalance(String accountId) {
        BigDecimal credits = ledgerRepository.sumForAccount(accountId, LedgerEntry.EntryType.CREDIT);
        BigDecimal debits = ledgerRepository.sumForAccount(accountId, LedgerEntry.EntryType.DEBIT);
        return Money.of(credits.subtract(debits));
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getAccountLedger(String accountId) {
        return ledgerRepository.findByAccountIdOrderByCreatedAtDesc(accountId);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getTransactionLedger(String transactionId) {
        return ledgerRepository.findByTransactionId(transactionId);
    }
}
