package com.securebank.transfers;

import com.securebank.accounts.Account;
import com.securebank.accounts.AccountRepository;
import com.securebank.accounts.AccountService;
import com.securebank.accounts.AccountStatus;
import com.securebank.accounts.AccountType;
import com.securebank.common.Money;
import com.securebank.common.exception.AccountInactiveException;
import com.securebank.common.exception.AccountNotFoundException;
import com.securebank.common.exception.InsufficientFundsException;
import com.securebank.common.exception.InvalidAmountException;
import com.securebank.common.exception.InvalidDestinationException;
import com.securebank.common.exception.SelfTransferException;
import com.securebank.common.exception.TransactionNotReversibleException;
import com.securebank.ledger.LedgerEntry;
import com.securebank.ledger.LedgerService;
import com.securebank.support.TestClockConfiguration;
import com.securebank.users.CredentialStore;
import com.securebank.users.User;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the transaction engine.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
@Transactional
class TransferServiceTest {

    @Autowired
    private TransferService transferService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private TransactionRepository transactionRepository;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private CredentialStore credentialStore;

    @Autowired
    private EntityManager entityManager;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private User alice;
    private User bob;
    private Account aliceChecking;
    private Account bobChecking;

    @BeforeEach
    void setUp() {
        alice = credentialStore.register("alice_t", "alice.t@example.com", "Str0ng!Pass", "Alice T", null);
        bob = credentialStore.register("bob_t", "bob.t@example.com", "Str0ng!Pass", "Bob T", null);
        aliceChecking = accountService.openAccount(alice.getUserId(), AccountType.CHECKING);
        bobChecking = accountService.openAccount(bob.getUserId(), AccountType.CHECKING);
        transferService.deposit(aliceChecking.getAccountId(), new BigDecimal("500.00"), "opening balance",
            "admin-id", "127.0.0.1", "junit");
    }

    @Test
    void testTransferMovesFundsAndWritesOneRecord() {
        TransferResult result = transferService.transfer(command(aliceChecking, bobChecking, "120.50", "Rent share"));

        assertEquals(TransactionStatus.COMPLETED, result.getStatus());
        assertEquals(Money.of("379.50"), balance(aliceChecking));
        assertEquals(Money.of("120.50"), balance(bobChecking));

        Transaction stored = transferService.getTransaction(result.getTransactionId());
        assertEquals(TransactionType.TRANSFER, stored.getTransactionType());
        assertEquals("Rent share", stored.getDescription());
        assertEquals(bobChecking.getAccountNumber(), stored.getCounterpartyAccountNumber());
        assertEquals(alice.getUserId(), stored.getInitiatedBy());

        List<LedgerEntry> entries = ledgerService.getTransactionLedger(result.getTransactionId());
        assertEquals(2, entries.size());
        assertEquals(balance(aliceChecking), ledgerService.getLedgerBalance(aliceChecking.getAccountId()));
        assertEquals(balance(bobChecking), ledgerService.getLedgerBalance(bobChecking.getAccountId()));
    }

    @Test
    void testInsufficientFundsLeavesBalancesAndRecordsFailure() {
        InsufficientFundsException e = assertThrows(InsufficientFundsException.class, () ->
            transferService.transfer(command(aliceChecking, bobChecking, "500.01", null)));

        assertEquals(Money.of("500.00"), balance(aliceChecking));
        assertEquals(Money.zero(), balance(bobChecking));

        Transaction failed = transferService.getTransaction(e.getTransactionId());
        assertEquals(TransactionStatus.FAILED, failed.getStatus());
        assertEquals("INSUFFICIENT_FUNDS", failed.getFailureReason());
        assertTrue(ledgerService.getTransactionLedger(failed.getTransactionId()).isEmpty());
    }

    @Test
    void testExactBalanceCanBeTransferred() {
        transferService.transfer(command(aliceChecking, bobChecking, "500.00", null));

        assertEquals(Money.zero(), balance(aliceChecking));
        assertEquals(Money.of("500.00"), balance(bobChecking));
    }

    @Test
    void testSelfTransferRejected() {
        assertThrows(SelfTransferException.class, () ->
            transferService.transfer(command(aliceChecking, aliceChecking, "10.00", null)));
        assertEquals(Money.of("500.00"), balance(aliceChecking));
    }

    @Test
    void testInvalidAmountsRejectedBeforeAnyRecord() {
        long before = transactionRepository.count();

        assertThrows(InvalidAmountException.class, () ->
            transferService.transfer(command(aliceChecking, bobChecking, "0.00", null)));
        assertThrows(InvalidAmountException.class, () ->
            transferService.transfer(command(aliceChecking, bobChecking, "-5.00", null)));
        assertThrows(InvalidAmountException.class, () ->
            transferService.transfer(command(aliceChecking, bobChecking, "1.005", null)));
        assertThrows(InvalidAmountException.class, () ->
            transferService.transfer(command(aliceChecking, bobChecking, "1000000.01", null)));

        assertEquals(before, transactionRepository.count());
    }

    @Test
    void testUnknownOrMalformedDestinationRejected() {
        assertThrows(InvalidDestinationException.class, () ->
            transferService.transfer(commandTo(aliceChecking, "12345", "10.00")));
        assertThrows(InvalidDestinationException.class, () ->
            transferService.transfer(commandTo(aliceChecking, "12345abcde", "10.00")));

        String unused = "0000000000".equals(bobChecking.getAccountNumber()) ? "0000000001" : "0000000000";
        assertThrows(InvalidDestinationException.class, () ->
            transferService.transfer(commandTo(aliceChecking, unused, "10.00")));
    }

    @Test
    void testCannotTransferFromAccountOfAnotherUser() {
        TransferCommand stolen = TransferCommand.builder()
            .initiatorUserId(bob.getUserId())
            .sourceAccountId(aliceChecking.getAccountId())
            .destinationAccountNumber(bobChecking.getAccountNumber())
            .amount(new BigDecimal("50.00"))
            .build();

        assertThrows(AccountNotFoundException.class, () -> transferService.transfer(stolen));
        assertEquals(Money.of("500.00"), balance(aliceChecking));
    }

    @Test
    void testDisabledAccountDeclinesWithFailedRecord() {
        accountService.setStatus(bobChecking.getAccountId(), AccountStatus.DISABLED, "admin-id");

        AccountInactiveException e = assertThrows(AccountInactiveException.class, () ->
            transferService.transfer(command(aliceChecking, bobChecking, "10.00", null)));

        assertEquals(TransactionStatus.FAILED, transferService.getTransaction(e.getTransactionId()).getStatus());
        assertEquals(Money.of("500.00"), balance(aliceChecking));
    }

    @Test
    void testReversalRestoresBalancesOnce() {
        TransferResult original = transferService.transfer(command(aliceChecking, bobChecking, "75.00", "Tickets"));

        TransferResult reversal = transferService.reverse(original.getTransactionId(), "admin-id",
            "Disputed", "127.0.0.1", "junit");

        assertEquals(TransactionStatus.REVERSED, reversal.getStatus());
        assertEquals(Money.of("500.00"), balance(aliceChecking));
        assertEquals(Money.zero(), balance(bobChecking));
        assertEquals(TransactionStatus.COMPLETED, transferService.getTransaction(original.getTransactionId()).getStatus());
        assertEquals(original.getTransactionId(), transferService.getTransaction(reversal.getTransactionId()).getReversalOf());
        assertEquals(balance(aliceChecking), ledgerService.getLedgerBalance(aliceChecking.getAccountId()));

        assertThrows(TransactionNotReversibleException.class, () ->
            transferService.reverse(original.getTransactionId(), "admin-id", "again", "127.0.0.1", "junit"));
        assertThrows(TransactionNotReversibleException.class, () ->
            transferService.reverse(reversal.getTransactionId(), "admin-id", "again", "127.0.0.1", "junit"));
    }

    @Test
    void testReversalNeedsFundsAtOriginalDestination() {
        Account bobSavings = accountService.openAccount(bob.getUserId(), AccountType.SAVINGS);
        TransferResult original = transferService.transfer(command(aliceChecking, bobChecking, "100.00", null));
        transferService.transfer(TransferCommand.builder()
            .initiatorUserId(bob.getUserId())
            .sourceAccountId(bobChecking.getAccountId())
            .destinationAccountNumber(bobSavings.getAccountNumber())
            .amount(new BigDecimal("60.00"))
            .build());

        assertThrows(InsufficientFundsException.class, () ->
            transferService.reverse(original.getTransactionId(), "admin-id", "Disputed", "127.0.0.1", "junit"));
    }

    @Test
    void testDepositCreditsAccountAndLedger() {
        TransferResult deposit = transferService.deposit(bobChecking.getAccountId(), new BigDecimal("42.10"),
            "Branch cash", "admin-id", "127.0.0.1", "junit");

        assertEquals(Money.of("42.10"), balance(bobChecking));
        assertEquals(Money.of("42.10"), ledgerService.getLedgerBalance(bobChecking.getAccountId()));
        assertEquals(TransactionType.DEPOSIT, transferService.getTransaction(deposit.getTransactionId()).getTransactionType());
        assertThrows(TransactionNotReversibleException.class, () ->
            transferService.reverse(deposit.getTransactionId(), "admin-id", "no", "127.0.0.1", "junit"));
    }

    @Test
    void testDescriptionIsEncryptedAtRest() {
        TransferResult result = transferService.transfer(command(aliceChecking, bobChecking, "5.00", "Birthday gift"));
        entityManager.flush();

        String stored = jdbcTemplate.queryForObject(
            "SELECT description FROM transactions WHERE transaction_id = ?", String.class, result.getTransactionId());
        String counterparty = jdbcTemplate.queryForObject(
            "SELECT counterparty_account_number FROM transactions WHERE transaction_id = ?", String.class,
            result.getTransactionId());

        assertNotNull(stored);
        assertFalse(stored.contains("Birthday"));
        assertNotEquals(bobChecking.getAccountNumber(), counterparty);
        assertEquals("Birthday gift", transferService.getTransaction(result.getTransactionId()).getDescription());
    }

    @Test
    void testHistoryIsScopedToOwner() {
        transferService.transfer(command(aliceChecking, bobChecking, "5.00", null));

        assertEquals(2, transferService.getAccountHistory(aliceChecking.getAccountId(), alice.getUserId()).size());
        assertEquals(1, transferService.getUserHistory(bob.getUserId(), PageRequest.of(0, 20)).getTotalElements());
        assertThrows(AccountNotFoundException.class, () ->
            transferService.getAccountHistory(aliceChecking.getAccountId(), bob.getUserId()));
    }

    @Test
    void testAdminSearchMatchesDecryptedDescription() {
        transferService.transfer(command(aliceChecking, bobChecking, "5.00", "Quarterly dues"));

        List<Transaction> found = transferService
            .listTransactions("quarterly", PageRequest.of(0, 1000)).getContent();

        assertEquals(1, found.size());
        assertEquals("Quarterly dues", found.get(0).getDescription());
    }

    private TransferCommand command(Account from, Account to, String amount, String description) {
        return TransferCommand.builder()
            .initiatorUserId(from.getOwnerId())
            .sourceAccountId(from.getAccountId())
            .destinationAccountNumber(to.getAccountNumber())
            .amount(new BigDecimal(amount))
            .description(description)
            .sourceIp("127.0.0.1")
            .userAgent("junit")
            .build();
    }

    private TransferCommand commandTo(Account from, String destinationNumber, String amount) {
        return TransferCommand.builder()
            .initiatorUserId(from.getOwnerId())
            .sourceAccountId(from.getAccountId())
            .destinationAccountNumber(destinationNumber)
            .amount(new BigDecimal(amount))
            .build();
    }

    private Money balance(Account account) {
        return accountRepository.findById(account.getAccountId()).orElseThrow().getBalance();
    }
}
