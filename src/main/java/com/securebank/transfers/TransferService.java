package com.securebank.transfers;

import com.securebank.accounts.Account;
import com.securebank.accounts.AccountNumberGenerator;
import com.securebank.accounts.AccountRepository;
import com.securebank.accounts.AccountService;
import com.securebank.common.Money;
import com.securebank.common.exception.AccountInactiveException;
import com.securebank.common.exception.AccountNotFoundException;
import com.securebank.common.exception.InsufficientFundsException;
import com.securebank.common.exception.InvalidAmountException;
import com.securebank.common.exception.InvalidDestinationException;
import com.securebank.common.exception.SelfTransferException;
import com.securebank.common.exception.TransactionNotFoundException;
import com.securebank.common.exception.TransactionNotReversibleException;
import com.securebank.ledger.LedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Moves funds between accounts.
 *
 * Transfer flow:
 * 1. Validate the amount and destination number without touching any balance
 * 2. Resolve both accounts and lock their rows in ascending id order
 * 3. Check status and funds against the locked rows
 * 4. Debit, credit, write the transaction record and its ledger entries in one database transaction
 *
 * Declines found in step 3 commit a FAILED record and no balance change; the exception carries
 * the record's id.
 */
@Service
@Slf4j
public class TransferService {

    private static final int MAX_DESCRIPTION_LENGTH = 500;

    private final AccountRepository accountRepository;
    private final AccountService accountService;
    private final TransactionRepository transactionRepository;
    private final LedgerService ledgerService;
    private final Clock clock;
    private final Money maxAmount;

    public TransferService(AccountRepository accountRepository,
                           AccountService accountService,
                           TransactionRepository transactionRepository,
                           LedgerService ledgerService,
                           Clock clock,
                           @Value("${secure-bank.transfers.max-amount:1000000.00}") BigDecimal maxAmount) {
        this.accountRepository = accountRepository;
        this.accountService = accountService;
        this.transactionRepository = transactionRepository;
        this.ledgerService = ledgerService;
        this.clock = clock;
        this.maxAmount = Money.of(maxAmount);
    }

    @Transactional(noRollbackFor = {InsufficientFundsException.class, AccountInactiveException.class})
    public TransferResult transfer(TransferCommand command) {
        Money amount = validateAmount(command.getAmount());
        validateDescription(command.getDescription());

        String destinationNumber = command.getDestinationAccountNumber();
        if (!AccountNumberGenerator.isWellFormed(destinationNumber)) {
            throw new InvalidDestinationException();
        }

        String sourceId = command.getSourceAccountId();
        String ownerId = accountRepository.findOwnerIdByAccountId(sourceId)
            .orElseThrow(() -> new AccountNotFoundException(sourceId));
        if (!ownerId.equals(command.getInitiatorUserId())) {
            log.warn("User {} attempted a transfer from account {} they do not own",
                command.getInitiatorUserId(), sourceId);
            throw new AccountNotFoundException(sourceId);
        }
        String destinationId = accountRepository.findIdByAccountNumber(destinationNumber)
            .orElseThrow(InvalidDestinationException::new);
        if (sourceId.equals(destinationId)) {
            throw new SelfTransferException();
        }

        LockedPair locked = lockInOrder(sourceId, destinationId);
        Account source = locked.get(sourceId);
        Account destination = locked.get(destinationId);
        Instant now = clock.instant();

        if (!source.isActive() || !destination.isActive()) {
            String inactiveId = source.isActive() ? destinationId : sourceId;
            Transaction failed = recordFailure(command, destinationId, amount, "ACCOUNT_INACTIVE", now);
            throw new AccountInactiveException(inactiveId).withTransactionId(failed.getTransactionId());
        }
        if (source.getBalance().isLessThan(amount)) {
            Transaction failed = recordFailure(command, destinationId, amount, "INSUFFICIENT_FUNDS", now);
            throw new InsufficientFundsException(sourceId, amount).withTransactionId(failed.getTransactionId());
        }

        source.debit(amount, now);
        destination.credit(amount, now);
        accountRepository.save(source);
        accountRepository.save(destination);

        Transaction transaction = transactionRepository.save(
            Transaction.completedTransfer(command, destinationId, amount, now));
        ledgerService.recordMovement(transaction.getTransactionId(), sourceId, destinationId, amount);

        log.info("Transfer {} completed: {} from {} to {} by user {}",
            transaction.getTransactionId(), amount, sourceId, destinationId, command.getInitiatorUserId());
        return TransferResult.of(transaction);
    }

    /**
     * Undo a completed transfer with a compensating REVERSAL record. The original is left as is.
     *
     * @throws TransactionNotReversibleException if the transaction is not a completed transfer or was already reversed
     */
    @Transactional
    public TransferResult reverse(String transactionId, String adminUserId, String reason,
                                  String sourceIp, String userAgent) {
        validateDescription(reason);
        Transaction original = transactionRepository.findById(transactionId)
            .orElseThrow(() -> new TransactionNotFoundException(transactionId));
        if (original.getTransactionType() != TransactionType.TRANSFER || !original.isCompleted()) {
            throw new TransactionNotReversibleException(transactionId, "only completed transfers can be reversed");
        }

        String originalSourceId = original.getSourceAccountId();
        String originalDestinationId = original.getDestinationAccountId();
        LockedPair locked = lockInOrder(originalSourceId, originalDestinationId);

        // checked under the account locks so two concurrent reversals cannot both pass
        if (transactionRepository.existsByReversalOf(transactionId)) {
            throw new TransactionNotReversibleException(transactionId, "already reversed");
        }

        Account refundTo = locked.get(originalSourceId);
        Account takeFrom = locked.get(originalDestinationId);
        Money amount = original.getAmount();
        Instant now = clock.instant();

        takeFrom.debit(amount, now);
        refundTo.credit(amount, now);
        accountRepository.save(takeFrom);
        accountRepository.save(refundTo);

        Transaction reversal = transactionRepository.save(Transaction.reversalOf(
            original, refundTo.getAccountNumber(), reason, adminUserId, sourceIp, userAgent, now));
        ledgerService.recordMovement(reversal.getTransactionId(), originalDestinationId, originalSourceId, amount);

        log.info("Transfer {} reversed by {} as {}: {} returned to {}",
            transactionId, adminUserId, reversal.getTransactionId(), amount, originalSourceId);
        return TransferResult.of(reversal);
    }

    /**
     * Administrative funding of an account.
     */
    @Transactional
    public TransferResult deposit(String accountId, BigDecimal rawAmount, String description,
                                  String adminUserId, String sourceIp, String userAgent) {
        Money amount = validateAmount(rawAmount);
        validateDescription(description);

        Account account = accountRepository.findByIdForUpdate(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
        if (!account.isActive()) {
            throw new AccountInactiveException(accountId);
        }

        Instant now = clock.instant();
        account.credit(amount, now);
        accountRepository.save(account);

        Transaction transaction = transactionRepository.save(
            Transaction.deposit(accountId, amount, description, adminUserId, sourceIp, userAgent, now));
        ledgerService.recordDeposit(transaction.getTransactionId(), accountId, amount);

        log.info("Deposit {} of {} to account {} by {}", transaction.getTransactionId(), amount, accountId, adminUserId);
        return TransferResult.of(transaction);
    }

    @Transactional(readOnly = true)
    public List<Transaction> getAccountHistory(String accountId, String ownerId) {
        accountService.getOwnedAccount(accountId, ownerId);
        return transactionRepository.findBySourceAccountIdOrDestinationAccountIdOrderByCreatedAtDesc(accountId, accountId);
    }

    @Transactional(readOnly = true)
    public Page<Transaction> getUserHistory(String userId, Pageable pageable) {
        List<String> accountIds = accountService.getAccountsByOwner(userId).stream()
            .map(Account::getAccountId)
            .collect(Collectors.toList());
        if (accountIds.isEmpty()) {
            return Page.empty(pageable);
        }
        return transactionRepository.findForAccounts(accountIds, pageable);
    }

    @Transactional(readOnly = true)
    public Transaction getTransaction(String transactionId) {
        return transactionRepository.findById(transactionId)
            .orElseThrow(() -> new TransactionNotFoundException(transactionId));
    }

    /**
     * Admin listing. Descriptions are encrypted at rest, so {@code search} filters the decrypted
     * content of the requested page; totals count the unfiltered listing.
     */
    @Transactional(readOnly = true)
    public Page<Transaction> listTransactions(String search, Pageable pageable) {
        Page<Transaction> page = transactionRepository.findAll(pageable);
        if (search == null || search.isBlank()) {
            return page;
        }
        String term = search.trim().toLowerCase(Locale.ROOT);
        List<Transaction> matching = page.getContent().stream()
            .filter(t -> contains(t.getDescription(), term)
                || contains(t.getCounterpartyAccountNumber(), term)
                || t.getTransactionId().startsWith(term))
            .collect(Collectors.toList());
        return new PageImpl<>(matching, pageable, page.getTotalElements());
    }

    private Money validateAmount(BigDecimal rawAmount) {
        if (rawAmount == null) {
            throw new InvalidAmountException("amount is required");
        }
        Money amount;
        try {
            amount = Money.exact(rawAmount);
        } catch (IllegalArgumentException e) {
            throw new InvalidAmountException("at most 2 decimal places are allowed");
        }
        if (!amount.isPositive()) {
            throw new InvalidAmountException("must be greater than zero");
        }
        if (amount.isGreaterThan(maxAmount)) {
            throw new InvalidAmountException("exceeds the single-transfer maximum of " + maxAmount);
        }
        return amount;
    }

    private static void validateDescription(String description) {
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new IllegalArgumentException("Description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
    }

    private Transaction recordFailure(TransferCommand command, String destinationId, Money amount,
                                      String reason, Instant now) {
        Transaction failed = transactionRepository.save(
            Transaction.failedTransfer(command, destinationId, amount, reason, now));
        log.warn("Transfer {} declined ({}): {} from {} by user {}",
            failed.getTransactionId(), reason, amount, command.getSourceAccountId(), command.getInitiatorUserId());
        return failed;
    }

    /**
     * Lock both account rows, lower id first, so that any two transfers over the same pair of
     * accounts acquire their locks in the same order.
     */
    private LockedPair lockInOrder(String firstId, String secondId) {
        String lowId = firstId.compareTo(secondId) <= 0 ? firstId : secondId;
        String highId = lowId.equals(firstId) ? secondId : firstId;
        Account low = accountRepository.findByIdForUpdate(lowId)
            .orElseThrow(() -> new AccountNotFoundException(lowId));
        Account high = accountRepository.findByIdForUpdate(highId)
            .orElseThrow(() -> new AccountNotFoundException(highId));
        return new LockedPair(low, high);
    }

    private static boolean contains(String value, String term) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(term);
    }

    private static final class LockedPair {
        private final Account low;
        private final Account high;

        LockedPair(Account low, Account high) {
            this.low = low;
            this.high = high;
        }

        Account get(String accountId) {
            return low.getAccountId().equals(accountId) ? low : high;
        }
    }
}
