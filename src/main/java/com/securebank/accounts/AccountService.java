package com.securebank.accounts;

import com.securebank.common.Money;
import com.securebank.common.exception.AccountNotFoundException;
import com.securebank.common.exception.AccountTypeAlreadyOpenException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Service for managing accounts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;
    private final AccountNumberGenerator numberGenerator;
    private final Clock clock;

    @Transactional
    public Account openAccount(String ownerId, AccountType accountType) {
        if (accountRepository.existsByOwnerIdAndAccountTypeAndStatus(ownerId, accountType, AccountStatus.ACTIVE)) {
            throw new AccountTypeAlreadyOpenException(accountType);
        }

        Account account = new Account(ownerId, numberGenerator.next(), accountType, clock.instant());
        try {
            accountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException e) {
            throw new IllegalStateException("Account number collision, retry the request", e);
        }

        log.info("Opened {} account {} for owner {}", accountType, account.getAccountId(), ownerId);
        return account;
    }

    @Transactional(readOnly = true)
    public Account getAccount(String accountId) {
        return accountRepository.findById(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    /**
     * Fetch an account only if it belongs to {@code ownerId}. Accounts of other users are
     * reported as not found.
     */
    @Transactional(readOnly = true)
    public Account getOwnedAccount(String accountId, String ownerId) {
        return accountRepository.findById(accountId)
            .filter(a -> a.getOwnerId().equals(ownerId))
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    @Transactional(readOnly = true)
    public List<Account> getAccountsByOwner(String ownerId) {
        return accountRepository.findByOwnerIdOrderByCreatedAtAsc(ownerId);
    }

    @Transactional(readOnly = true)
    public Money getTotalBalance(String ownerId) {
        return getAccountsByOwner(ownerId).stream()
            .map(Account::getBalance)
            .reduce(Money.zero(), Money::add);
    }

    @Transactional(readOnly = true)
    public Page<Account> listAccounts(String search, Pageable pageable) {
        if (search == null || search.isBlank()) {
            return accountRepository.findAll(pageable);
        }
        return accountRepository.search(search.trim(), pageable);
    }

    @Transactional
    public Account setStatus(String accountId, AccountStatus status, String actorUserId) {
        Account account = accountRepository.findByIdForUpdate(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
        if (status == AccountStatus.ACTIVE && account.getStatus() != AccountStatus.ACTIVE
                && accountRepository.existsByOwnerIdAndAccountTypeAndStatus(
                    account.getOwnerId(), account.getAccountType(), AccountStatus.ACTIVE)) {
            throw new AccountTypeAlreadyOpenException(account.getAccountType());
        }
        account.changeStatus(status, clock.instant());
        accountRepository.save(account);
        log.info("Account {} set to {} by {}", accountId, status, actorUserId);
        return account;
    }
}
