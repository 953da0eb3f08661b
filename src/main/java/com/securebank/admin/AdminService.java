package com.securebank.admin;

import com.securebank.accounts.AccountRepository;
import com.securebank.accounts.AccountService;
import com.securebank.common.Money;
import com.securebank.common.exception.UserNotFoundException;
import com.securebank.lockout.LockoutTracker;
import com.securebank.lockout.LoginAttemptRepository;
import com.securebank.lockout.LoginOutcome;
import com.securebank.session.SessionManager;
import com.securebank.transfers.TransactionRepository;
import com.securebank.transfers.TransactionStatus;
import com.securebank.users.CredentialStore;
import com.securebank.users.User;
import com.securebank.users.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Administrative operations over users and accounts. Callers are checked by the admin guard
 * before reaching this service.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminService {

    private final UserRepository userRepository;
    private final AccountRepository accountRepository;
    private final AccountService accountService;
    private final TransactionRepository transactionRepository;
    private final LoginAttemptRepository attemptRepository;
    private final CredentialStore credentialStore;
    private final LockoutTracker lockoutTracker;
    private final SessionManager sessionManager;
    private final Clock clock;

    @Transactional(readOnly = true)
    public SystemOverview getOverview() {
        Instant now = clock.instant();
        Instant startOfDay = now.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.DAYS).toInstant();

        return SystemOverview.builder()
            .totalUsers(userRepository.count())
            .activeUsers(userRepository.countByActiveTrue())
            .lockedUsers(userRepository.countByLockedUntilAfter(now))
            .failedLoginsToday(attemptRepository.countByOutcomeAndAttemptedAtAfter(LoginOutcome.FAILURE, startOfDay))
            .totalAccounts(accountRepository.count())
            .totalTransactions(transactionRepository.count())
            .failedTransactions(transactionRepository.countByStatus(TransactionStatus.FAILED))
            .totalBalance(Money.of(accountRepository.sumBalances()))
            .build();
    }

    @Transactional(readOnly = true)
    public Page<User> listUsers(String search, Pageable pageable) {
        if (search == null || search.isBlank()) {
            return userRepository.findAll(pageable);
        }
        return userRepository.search(search.trim(), pageable);
    }

    @Transactional(readOnly = true)
    public UserDetail getUserDetail(String userId) {
        User user = credentialStore.getUser(userId);
        return new UserDetail(user,
            accountService.getAccountsByOwner(userId),
            lockoutTracker.currentState(user.getUsername()),
            attemptRepository.findTop10ByUsernameOrderByAttemptedAtDescAttemptIdDesc(user.getUsername()));
    }

    /**
     * Activate or deactivate a user. Deactivation revokes every session of the user.
     * Administrators cannot change their own status.
     */
    @Transactional
    public User setUserActive(String userId, boolean active, String actorUserId) {
        if (userId.equals(actorUserId)) {
            throw new IllegalArgumentException("Administrators cannot change their own status");
        }
        User user = userRepository.findById(userId)
            .orElseThrow(() -> new UserNotFoundException(userId));

        if (active) {
            user.activate(clock.instant());
        } else {
            user.deactivate(clock.instant());
            sessionManager.revokeAll(userId);
        }
        userRepository.save(user);
        log.info("User {} {} by {}", userId, active ? "activated" : "deactivated", actorUserId);
        return user;
    }

    @Transactional
    public void unlockUser(String userId, String actorUserId) {
        User user = credentialStore.getUser(userId);
        lockoutTracker.reset(user.getUsername(), actorUserId);
    }

    /**
     * Set a new password for a user, lift any lock and end their sessions.
     */
    @Transactional
    public void resetPassword(String userId, String newPassword, String actorUserId) {
        User user = credentialStore.getUser(userId);
        credentialStore.rehash(userId, newPassword);
        lockoutTracker.reset(user.getUsername(), actorUserId);
        sessionManager.revokeAll(userId);
        log.info("Password for user {} reset by {}", userId, actorUserId);
    }
}
