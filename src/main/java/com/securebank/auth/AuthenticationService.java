package com.securebank.auth;

import com.securebank.common.exception.AccountLockedException;
import com.securebank.common.exception.AuthenticationFailureException;
import com.securebank.lockout.LockoutDecision;
import com.securebank.lockout.LockoutState;
import com.securebank.lockout.LockoutTracker;
import com.securebank.lockout.LoginOutcome;
import com.securebank.session.AuthenticatedSession;
import com.securebank.session.IssuedSession;
import com.securebank.session.SessionManager;
import com.securebank.users.CredentialStore;
import com.securebank.users.MatchResult;
import com.securebank.users.User;
import com.securebank.users.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Login, logout and password change.
 *
 * Login flow:
 * 1. Reject without hashing if the account is already locked (the attempt is still logged)
 * 2. Verify the credentials
 * 3. Record the outcome with the lockout tracker
 * 4. On success stamp the last login and issue a session
 *
 * Rejections commit the attempt log before the exception reaches the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthenticationService {

    private final CredentialStore credentialStore;
    private final LockoutTracker lockoutTracker;
    private final SessionManager sessionManager;
    private final UserRepository userRepository;
    private final Clock clock;

    @Transactional(noRollbackFor = {AccountLockedException.class, AuthenticationFailureException.class})
    public LoginResult login(String username, String rawPassword, String sourceIp, String userAgent) {
        LockoutState state = lockoutTracker.currentState(username);
        if (state.isLockedAt(clock.instant())) {
            LockoutDecision decision = lockoutTracker.checkAndRecord(username, LoginOutcome.FAILURE, sourceIp, userAgent);
            throw new AccountLockedException(decision.getRemainingLockSeconds());
        }

        MatchResult match = credentialStore.verify(username, rawPassword);
        LockoutDecision decision = lockoutTracker.checkAndRecord(username,
            match.isOk() ? LoginOutcome.SUCCESS : LoginOutcome.FAILURE, sourceIp, userAgent);

        if (decision.isBlocked()) {
            // locked by a concurrent attempt between the pre-check and the record
            throw new AccountLockedException(decision.getRemainingLockSeconds());
        }
        if (!match.isOk()) {
            throw new AuthenticationFailureException();
        }

        User user = credentialStore.getUser(match.getUserId());
        user.recordLogin(clock.instant());
        userRepository.save(user);

        IssuedSession session = sessionManager.create(user.getUserId(), sourceIp);
        log.info("User {} logged in from {}", user.getUserId(), sourceIp);
        return new LoginResult(user, session);
    }

    public void logout(String token) {
        sessionManager.revoke(token);
    }

    /**
     * Change the caller's own password. The current password is checked like a login attempt,
     * and every other session of the user is revoked afterwards.
     */
    @Transactional(noRollbackFor = {AccountLockedException.class, AuthenticationFailureException.class})
    public void changePassword(AuthenticatedSession session, String currentPassword, String newPassword,
                               String sourceIp, String userAgent) {
        String username = session.getUser().getUsername();
        LockoutState state = lockoutTracker.currentState(username);
        if (state.isLockedAt(clock.instant())) {
            throw new AccountLockedException(state.remainingSecondsAt(clock.instant()));
        }

        MatchResult match = credentialStore.verify(username, currentPassword);
        if (!match.isOk()) {
            LockoutDecision decision = lockoutTracker.checkAndRecord(username, LoginOutcome.FAILURE, sourceIp, userAgent);
            if (decision.isBlocked()) {
                throw new AccountLockedException(decision.getRemainingLockSeconds());
            }
            throw new AuthenticationFailureException();
        }

        credentialStore.rehash(session.getUserId(), newPassword);
        sessionManager.revokeOthers(session.getUserId(), session.getSessionId());
        log.info("User {} changed their password", session.getUserId());
    }
}
