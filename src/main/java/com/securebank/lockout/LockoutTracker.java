package com.securebank.lockout;

import com.securebank.users.User;
import com.securebank.users.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Records login attempts and decides lock state per account.
 *
 * State machine per username:
 * <pre>
 * Unlocked --(threshold failures inside window)--> Locked(until = lastFailure + duration)
 * Locked   --(duration elapses)-----------------> Unlocked (counter reset)
 * any      --(SUCCESS or RESET)------------------> Unlocked (counter reset)
 * </pre>
 *
 * The lock is always recomputed from the attempt log. The counters stored on {@link User} are
 * only a projection of the latest evaluation, so resetting them cannot lift a lock.
 *
 * Lockout state lives in the shared database, so every service instance sees the same locks.
 */
@Service
@Slf4j
public class LockoutTracker {

    private final LoginAttemptRepository attemptRepository;
    private final UserRepository userRepository;
    private final Clock clock;
    private final int threshold;
    private final Duration window;
    private final Duration lockDuration;

    public LockoutTracker(LoginAttemptRepository attemptRepository,
                          UserRepository userRepository,
                          Clock clock,
                          @Value("${secure-bank.lockout.threshold:3}") int threshold,
                          @Value("${secure-bank.lockout.window:15m}") Duration window,
                          @Value("${secure-bank.lockout.duration:30m}") Duration lockDuration) {
        if (threshold < 1) {
            throw new IllegalArgumentException("secure-bank.lockout.threshold must be at least 1");
        }
        this.attemptRepository = attemptRepository;
        this.userRepository = userRepository;
        this.clock = clock;
        this.threshold = threshold;
        this.window = window;
        this.lockDuration = lockDuration;
    }

    /**
     * Record a login attempt and return the resulting decision.
     *
     * The attempt row is flushed before this method returns. When the account is already locked
     * the attempt is stored as {@link LoginOutcome#BLOCKED} whatever the supplied outcome.
     *
     * @param outcome {@link LoginOutcome#SUCCESS} or {@link LoginOutcome#FAILURE}
     */
    @Transactional
    public LockoutDecision checkAndRecord(String username, LoginOutcome outcome,
                                          String sourceIp, String userAgent) {
        if (outcome != LoginOutcome.SUCCESS && outcome != LoginOutcome.FAILURE) {
            throw new IllegalArgumentException("Only SUCCESS or FAILURE can be recorded for a login: " + outcome);
        }

        username = logKey(username);
        // Serializes concurrent attempts against an existing account
        Optional<User> user = userRepository.findByUsernameForUpdate(username);
        Instant now = clock.instant();

        List<LoginAttempt> history = loadHistory(username, now);
        LockoutState before = replay(history, now);

        if (before.isLockedAt(now)) {
            LoginAttempt blocked = new LoginAttempt(username, LoginOutcome.BLOCKED, sourceIp, userAgent, now);
            attemptRepository.saveAndFlush(blocked);
            user.ifPresent(u -> project(u, before, now));

            long remaining = before.remainingSecondsAt(now);
            log.warn("Login attempt for '{}' from {} rejected: account locked for another {}s",
                username, sourceIp, remaining);
            return new LockoutDecision(false, remaining, before.getFailureCount(), true);
        }

        LoginAttempt attempt = new LoginAttempt(username, outcome, sourceIp, userAgent, now);
        attemptRepository.saveAndFlush(attempt);

        List<LoginAttempt> updated = new ArrayList<>(history);
        updated.add(attempt);
        LockoutState after = replay(updated, now);
        user.ifPresent(u -> project(u, after, now));

        if (after.isLockedAt(now)) {
            log.warn("Account '{}' locked until {} after {} failed attempts",
                username, after.getLockedUntil(), threshold);
        } else if (outcome == LoginOutcome.FAILURE) {
            log.info("Failed login for '{}' from {} ({} of {})",
                username, sourceIp, after.getFailureCount(), threshold);
        }

        return new LockoutDecision(outcome == LoginOutcome.SUCCESS,
            after.remainingSecondsAt(now), after.getFailureCount(), false);
    }

    /**
     * Current lock state without recording anything.
     */
    @Transactional(readOnly = true)
    public LockoutState currentState(String username) {
        Instant now = clock.instant();
        return replay(loadHistory(logKey(username), now), now);
    }

    /**
     * Administrative unlock. Appends an audited RESET attempt that clears any lock and the
     * failure counter.
     */
    @Transactional
    public void reset(String username, String actorUserId) {
        username = logKey(username);
        Optional<User> user = userRepository.findByUsernameForUpdate(username);
        Instant now = clock.instant();

        attemptRepository.saveAndFlush(
            new LoginAttempt(username, LoginOutcome.RESET, null, "reset-by:" + actorUserId, now));
        user.ifPresent(u -> project(u, LockoutState.unlocked(0), now));

        log.info("Lockout for '{}' reset by {}", username, actorUserId);
    }

    /**
     * Usernames are stored in the log truncated to the column width; look them up the same way.
     */
    private static String logKey(String username) {
        if (username == null) {
            return "";
        }
        return username.length() > LoginAttempt.MAX_USERNAME_LENGTH
            ? username.substring(0, LoginAttempt.MAX_USERNAME_LENGTH) : username;
    }

    private List<LoginAttempt> loadHistory(String username, Instant now) {
        // A lock still active now started within lockDuration, and its failures within window before that
        Instant horizon = now.minus(window).minus(lockDuration);
        return attemptRepository.findByUsernameAndAttemptedAtAfterOrderByAttemptedAtAscAttemptIdAsc(username, horizon);
    }

    /**
     * Replay attempts in chronological order and return the state at {@code now}.
     */
    LockoutState replay(List<LoginAttempt> attempts, Instant now) {
        Deque<Instant> failures = new ArrayDeque<>();
        Instant lockedUntil = null;
        int lockingFailures = 0;

        for (LoginAttempt attempt : attempts) {
            Instant at = attempt.getAttemptedAt();
            if (lockedUntil != null && !at.isBefore(lockedUntil)) {
                lockedUntil = null;
                failures.clear();
            }

            switch (attempt.getOutcome()) {
                case SUCCESS, RESET -> {
                    lockedUntil = null;
                    failures.clear();
                }
                case FAILURE -> {
                    if (lockedUntil != null) {
                        // raced past the lock check; does not extend the lock
                        continue;
                    }
                    evictOlderThan(failures, at.minus(window));
                    failures.addLast(at);
                    if (failures.size() >= threshold) {
                        lockedUntil = at.plus(lockDuration);
                        lockingFailures = failures.size();
                        failures.clear();
                    }
                }
                case BLOCKED -> {
                    // rejected while locked; ignored
                }
            }
        }

        if (lockedUntil != null) {
            if (now.isBefore(lockedUntil)) {
                return new LockoutState(lockingFailures, lockedUntil);
            }
            failures.clear();
        }
        evictOlderThan(failures, now.minus(window));
        return LockoutState.unlocked(failures.size());
    }

    private static void evictOlderThan(Deque<Instant> failures, Instant cutoff) {
        while (!failures.isEmpty() && failures.peekFirst().isBefore(cutoff)) {
            failures.removeFirst();
        }
    }

    private void project(User user, LockoutState state, Instant now) {
        Instant lockedUntil = state.isLockedAt(now) ? state.getLockedUntil() : null;
        user.recordLockoutState(state.getFailureCount(), lockedUntil, now);
        userRepository.save(user);
    }
}
