package com.securebank.session;

import com.securebank.common.exception.SessionExpiredException;
import com.securebank.common.exception.SessionNotFoundException;
import com.securebank.users.User;
import com.securebank.users.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Creates, validates and revokes server-side sessions.
 *
 * Sessions expire after an idle timeout that slides on every validated request, capped by an
 * absolute lifetime measured from creation.
 */
@Service
@Slf4j
public class SessionManager {

    private static final int TOKEN_BYTES = 32;

    private final UserSessionRepository sessionRepository;
    private final UserRepository userRepository;
    private final CsrfTokenManager csrfTokenManager;
    private final SecureRandom secureRandom;
    private final Clock clock;
    private final Duration idleTimeout;
    private final Duration absoluteTimeout;

    public SessionManager(UserSessionRepository sessionRepository,
                          UserRepository userRepository,
                          CsrfTokenManager csrfTokenManager,
                          SecureRandom secureRandom,
                          Clock clock,
                          @Value("${secure-bank.session.idle-timeout:30m}") Duration idleTimeout,
                          @Value("${secure-bank.session.absolute-timeout:12h}") Duration absoluteTimeout) {
        this.sessionRepository = sessionRepository;
        this.userRepository = userRepository;
        this.csrfTokenManager = csrfTokenManager;
        this.secureRandom = secureRandom;
        this.clock = clock;
        this.idleTimeout = idleTimeout;
        this.absoluteTimeout = absoluteTimeout;
    }

    @Transactional
    public IssuedSession create(String userId, String sourceIp) {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        String token = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);

        UserSession session = new UserSession(digest(token), userId, csrfTokenManager.issue(), sourceIp,
            clock.instant(), idleTimeout, absoluteTimeout);
        sessionRepository.save(session);

        log.info("Session {} created for user {}", shortId(session.getSessionId()), userId);
        return new IssuedSession(token, session);
    }

    /**
     * Resolve a token to its session and extend the idle expiry.
     *
     * @throws SessionNotFoundException if the token is unknown or its user is no longer active
     * @throws SessionExpiredException  if the session has expired; it is deleted
     */
    @Transactional(noRollbackFor = {SessionNotFoundException.class, SessionExpiredException.class})
    public AuthenticatedSession validate(String token) {
        if (token == null || token.isBlank()) {
            throw new SessionNotFoundException();
        }
        UserSession session = sessionRepository.findById(digest(token))
            .orElseThrow(SessionNotFoundException::new);
        Instant now = clock.instant();

        if (session.isExpiredAt(now)) {
            sessionRepository.delete(session);
            log.debug("Session {} expired at {}", shortId(session.getSessionId()), session.getExpiresAt());
            throw new SessionExpiredException();
        }

        Optional<User> user = userRepository.findById(session.getUserId());
        if (user.isEmpty() || !user.get().isActive()) {
            sessionRepository.delete(session);
            log.warn("Session {} revoked: user {} is not active", shortId(session.getSessionId()), session.getUserId());
            throw new SessionNotFoundException();
        }

        session.touch(now, idleTimeout);
        sessionRepository.save(session);
        return new AuthenticatedSession(session.getSessionId(), user.get(), session.getCsrfToken());
    }

    /**
     * Look up a session without extending or deleting it. Empty for unknown, expired or
     * inactive-user sessions.
     */
    @Transactional(readOnly = true)
    public Optional<AuthenticatedSession> peek(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        return sessionRepository.findById(digest(token))
            .filter(s -> !s.isExpiredAt(now))
            .flatMap(s -> userRepository.findById(s.getUserId())
                .filter(User::isActive)
                .map(u -> new AuthenticatedSession(s.getSessionId(), u, s.getCsrfToken())));
    }

    @Transactional
    public void revoke(String token) {
        if (token == null || token.isBlank()) {
            return;
        }
        String sessionId = digest(token);
        sessionRepository.findById(sessionId).ifPresent(s -> {
            sessionRepository.delete(s);
            log.info("Session {} revoked for user {}", shortId(sessionId), s.getUserId());
        });
    }

    @Transactional
    public int revokeAll(String userId) {
        int revoked = sessionRepository.deleteAllForUser(userId);
        log.info("Revoked {} sessions for user {}", revoked, userId);
        return revoked;
    }

    /**
     * Revoke every session of a user except the one identified by {@code keepSessionId}.
     */
    @Transactional
    public int revokeOthers(String userId, String keepSessionId) {
        int revoked = sessionRepository.deleteAllForUserExcept(userId, keepSessionId);
        log.info("Revoked {} other sessions for user {}", revoked, userId);
        return revoked;
    }

    @Scheduled(fixedDelayString = "${secure-bank.session.purge-interval-ms:300000}")
    @Transactional
    public void purgeExpired() {
        int purged = sessionRepository.deleteExpired(clock.instant());
        if (purged > 0) {
            log.debug("Purged {} expired sessions", purged);
        }
    }

    static String digest(String token) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha256.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String shortId(String sessionId) {
        return sessionId.substring(0, 8);
    }
}
