package com.securebank.session;

import com.securebank.common.exception.SessionExpiredException;
import com.securebank.common.exception.SessionNotFoundException;
import com.securebank.support.MutableClock;
import com.securebank.support.TestClockConfiguration;
import com.securebank.users.CredentialStore;
import com.securebank.users.User;
import com.securebank.users.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for session lifetime and revocation.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
@Transactional
class SessionManagerTest {

    @Autowired
    private SessionManager sessionManager;

    @Autowired
    private UserSessionRepository sessionRepository;

    @Autowired
    private CredentialStore credentialStore;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private MutableClock clock;

    private User user;

    @BeforeEach
    void setUp() {
        user = credentialStore.register("erin_s", "erin@example.com", "Str0ng!Pass", "Erin S", null);
    }

    @Test
    void testTokenIsStoredOnlyAsDigest() {
        IssuedSession issued = sessionManager.create(user.getUserId(), "192.0.2.1");

        assertFalse(sessionRepository.existsById(issued.getToken()));
        assertTrue(sessionRepository.existsById(SessionManager.digest(issued.getToken())));
        assertEquals(64, issued.getSession().getSessionId().length());
        assertNotEquals(issued.getToken(), issued.getSession().getCsrfToken());
    }

    @Test
    void testTokensAreUnique() {
        IssuedSession first = sessionManager.create(user.getUserId(), "192.0.2.1");
        IssuedSession second = sessionManager.create(user.getUserId(), "192.0.2.1");

        assertNotEquals(first.getToken(), second.getToken());
        assertNotEquals(first.getSession().getCsrfToken(), second.getSession().getCsrfToken());
        assertEquals(2, sessionRepository.countByUserId(user.getUserId()));
    }

    @Test
    void testIdleTimeoutExpiresSession() {
        String token = sessionManager.create(user.getUserId(), "192.0.2.1").getToken();

        clock.advance(Duration.ofMinutes(30));

        assertThrows(SessionExpiredException.class, () -> sessionManager.validate(token));
        assertThrows(SessionNotFoundException.class, () -> sessionManager.validate(token));
    }

    @Test
    void testActivitySlidesIdleExpiry() {
        String token = sessionManager.create(user.getUserId(), "192.0.2.1").getToken();

        for (int i = 0; i < 4; i++) {
            clock.advance(Duration.ofMinutes(20));
            assertEquals(user.getUserId(), sessionManager.validate(token).getUserId());
        }
    }

    @Test
    void testAbsoluteTimeoutCapsSlidingExpiry() {
        IssuedSession issued = sessionManager.create(user.getUserId(), "192.0.2.1");
        Instant absolute = issued.getSession().getAbsoluteExpiresAt();

        while (clock.instant().plus(Duration.ofMinutes(20)).isBefore(absolute)) {
            clock.advance(Duration.ofMinutes(20));
            sessionManager.validate(issued.getToken());
        }
        UserSession stored = sessionRepository.findById(issued.getSession().getSessionId()).orElseThrow();
        assertFalse(stored.getExpiresAt().isAfter(absolute));

        clock.set(absolute);
        assertThrows(SessionExpiredException.class, () -> sessionManager.validate(issued.getToken()));
    }

    @Test
    void testPeekDoesNotExtendSession() {
        IssuedSession issued = sessionManager.create(user.getUserId(), "192.0.2.1");
        Instant expiresAt = issued.getSession().getExpiresAt();

        clock.advance(Duration.ofMinutes(10));
        assertTrue(sessionManager.peek(issued.getToken()).isPresent());

        UserSession stored = sessionRepository.findById(issued.getSession().getSessionId()).orElseThrow();
        assertEquals(expiresAt, stored.getExpiresAt());

        clock.advance(Duration.ofMinutes(20));
        assertTrue(sessionManager.peek(issued.getToken()).isEmpty());
    }

    @Test
    void testUnknownAndBlankTokensRejected() {
        assertThrows(SessionNotFoundException.class, () -> sessionManager.validate("not-a-token"));
        assertThrows(SessionNotFoundException.class, () -> sessionManager.validate(""));
        assertThrows(SessionNotFoundException.class, () -> sessionManager.validate(null));
        assertTrue(sessionManager.peek(null).isEmpty());
    }

    @Test
    void testRevokeEndsSession() {
        String token = sessionManager.create(user.getUserId(), "192.0.2.1").getToken();

        sessionManager.revoke(token);

        assertThrows(SessionNotFoundException.class, () -> sessionManager.validate(token));
    }

    @Test
    void testRevokeAllAndRevokeOthers() {
        IssuedSession keep = sessionManager.create(user.getUserId(), "192.0.2.1");
        sessionManager.create(user.getUserId(), "192.0.2.2");
        sessionManager.create(user.getUserId(), "192.0.2.3");

        assertEquals(2, sessionManager.revokeOthers(user.getUserId(), keep.getSession().getSessionId()));
        assertEquals(1, sessionRepository.countByUserId(user.getUserId()));
        assertEquals(user.getUserId(), sessionManager.validate(keep.getToken()).getUserId());

        assertEquals(1, sessionManager.revokeAll(user.getUserId()));
        assertThrows(SessionNotFoundException.class, () -> sessionManager.validate(keep.getToken()));
    }

    @Test
    void testSessionOfDeactivatedUserIsRejected() {
        String token = sessionManager.create(user.getUserId(), "192.0.2.1").getToken();
        User stored = userRepository.findById(user.getUserId()).orElseThrow();
        stored.deactivate(clock.instant());
        userRepository.saveAndFlush(stored);

        assertTrue(sessionManager.peek(token).isEmpty());
        assertThrows(SessionNotFoundException.class, () -> sessionManager.validate(token));
        assertEquals(0, sessionRepository.countByUserId(user.getUserId()));
    }

    @Test
    void testPurgeRemovesExpiredSessions() {
        sessionManager.create(user.getUserId(), "192.0.2.1");
        clock.advance(Duration.ofMinutes(31));
        String fresh = sessionManager.create(user.getUserId(), "192.0.2.2").getToken();

        sessionManager.purgeExpired();

        assertEquals(1, sessionRepository.countByUserId(user.getUserId()));
        assertNotNull(sessionManager.validate(fresh));
    }
}
