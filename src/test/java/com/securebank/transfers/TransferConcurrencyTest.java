package com.securebank.transfers;

import com.securebank.accounts.Account;
import com.securebank.accounts.AccountRepository;
import com.securebank.accounts.AccountService;
import com.securebank.accounts.AccountType;
import com.securebank.common.Money;
import com.securebank.common.exception.InsufficientFundsException;
import com.securebank.ledger.LedgerService;
import com.securebank.support.TestClockConfiguration;
import com.securebank.support.TestUsers;
import com.securebank.users.CredentialStore;
import com.securebank.users.User;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent transfers against real committed rows. Not transactional: every transfer commits
 * on its own thread.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
class TransferConcurrencyTest {

    private static final int THREADS = 10;

    @Autowired
    private TransferService transferService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private CredentialStore credentialStore;

    private ExecutorService executor;
    private Account source;
    private Account destination;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(THREADS);
        source = openFundedAccount("100.00");
        destination = openFundedAccount("100.00");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testConcurrentDebitsNeverOverdraw() throws Exception {
        List<Future<Boolean>> outcomes = runConcurrently(THREADS, i -> () -> {
            try {
                transferService.transfer(command(source, destination, "30.00"));
                return true;
            } catch (InsufficientFundsException e) {
                return false;
            }
        });

        int succeeded = 0;
        for (Future<Boolean> outcome : outcomes) {
            if (outcome.get(30, TimeUnit.SECONDS)) {
                succeeded++;
            }
        }

        assertEquals(3, succeeded);
        assertEquals(Money.of("10.00"), balance(source));
        assertEquals(Money.of("190.00"), balance(destination));
        assertEquals(balance(source), ledgerService.getLedgerBalance(source.getAccountId()));
        assertEquals(balance(destination), ledgerService.getLedgerBalance(destination.getAccountId()));
    }

    @Test
    void testOpposingTransfersDoNotDeadlock() throws Exception {
        List<Future<Boolean>> outcomes = runConcurrently(THREADS * 2, i -> () -> {
            if (i % 2 == 0) {
                transferService.transfer(command(source, destination, "1.00"));
            } else {
                transferService.transfer(command(destination, source, "1.00"));
            }
            return true;
        });

        for (Future<Boolean> outcome : outcomes) {
            assertTrue(outcome.get(30, TimeUnit.SECONDS));
        }

        assertEquals(Money.of("100.00"), balance(source));
        assertEquals(Money.of("100.00"), balance(destination));
        assertEquals(Money.of("100.00"), ledgerService.getLedgerBalance(source.getAccountId()));
    }

    @Test
    void testRandomizedTransfersPreserveBalances() throws Exception {
        List<Account> accounts = List.of(source, destination, openFundedAccount("100.00"), openFundedAccount("100.00"));
        Random random = new Random(20240501L);
        List<TransferCommand> commands = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            int from = random.nextInt(accounts.size());
            int to = (from + 1 + random.nextInt(accounts.size() - 1)) % accounts.size();
            BigDecimal amount = BigDecimal.valueOf(100 + random.nextInt(6000), 2);
            commands.add(command(accounts.get(from), accounts.get(to), amount.toPlainString()));
        }

        List<Future<Boolean>> outcomes = runConcurrently(commands.size(), i -> () -> {
            try {
                transferService.transfer(commands.get(i));
                return true;
            } catch (InsufficientFundsException e) {
                return false;
            }
        });
        for (Future<Boolean> outcome : outcomes) {
            outcome.get(60, TimeUnit.SECONDS);
        }

        BigDecimal total = BigDecimal.ZERO;
        for (Account account : accounts) {
            Money balance = balance(account);
            assertFalse(balance.isNegative());
            assertEquals(0, balance.getAmount().compareTo(
                ledgerService.getLedgerBalance(account.getAccountId()).getAmount()));
            total = total.add(balance.getAmount());
        }
        assertEquals(0, new BigDecimal("400.00").compareTo(total));
    }

    private List<Future<Boolean>> runConcurrently(int tasks, TaskFactory factory) throws InterruptedException {
        CountDownLatch ready = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < tasks; i++) {
            Callable<Boolean> task = factory.create(i);
            futures.add(executor.submit(() -> {
                ready.await();
                return task.call();
            }));
        }
        ready.countDown();
        return futures;
    }

    private Account openFundedAccount(String amount) {
        String username = TestUsers.username();
        User user = credentialStore.register(username, TestUsers.email(username), TestUsers.PASSWORD,
            "Concurrent User", null);
        Account account = accountService.openAccount(user.getUserId(), AccountType.CHECKING);
        transferService.deposit(account.getAccountId(), new BigDecimal(amount), null, "admin-id", "127.0.0.1", "junit");
        return account;
    }

    private TransferCommand command(Account from, Account to, String amount) {
        return TransferCommand.builder()
            .initiatorUserId(from.getOwnerId())
            .sourceAccountId(from.getAccountId())
            .destinationAccountNumber(to.getAccountNumber())
            .amount(new BigDecimal(amount))
            .sourceIp("127.0.0.1")
            .userAgent("junit")
            .build();
    }

    private Money balance(Account account) {
        return accountRepository.findById(account.getAccountId()).orElseThrow().getBalance();
    }

    @FunctionalInterface
    private interface TaskFactory {
        Callable<Boolean> create(int index);
    }
}
