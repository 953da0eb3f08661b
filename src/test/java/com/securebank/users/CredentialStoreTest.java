package com.securebank.users;

import com.securebank.common.exception.DuplicateIdentityException;
import com.securebank.common.exception.WeakPasswordException;
import com.securebank.guard.Role;
import com.securebank.support.TestClockConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for registration and credential verification.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
@Transactional
class CredentialStoreTest {

    @Autowired
    private CredentialStore credentialStore;

    @Autowired
    private UserRepository userRepository;

    @Test
    void testRegisterStoresHashNotPassword() {
        User user = credentialStore.register("alice_w", "Alice@Example.com", "Str0ng!Pass", "Alice Walker", null);

        User stored = userRepository.findById(user.getUserId()).orElseThrow();
        assertEquals("alice_w", stored.getUsername());
        assertEquals("alice@example.com", stored.getEmail());
        assertEquals(Role.STANDARD, stored.getRole());
        assertTrue(stored.isActive());
        assertNotEquals("Str0ng!Pass", stored.getPasswordHash());
        assertFalse(stored.getPasswordHash().contains("Str0ng!Pass"));
    }

    @Test
    void testDuplicateUsernameAndEmailRejected() {
        credentialStore.register("bob_1", "bob@example.com", "Str0ng!Pass", "Bob One", null);

        DuplicateIdentityException byName = assertThrows(DuplicateIdentityException.class, () ->
            credentialStore.register("bob_1", "other@example.com", "Str0ng!Pass", "Bob Two", null));
        assertEquals("username", byName.getField());

        DuplicateIdentityException byEmail = assertThrows(DuplicateIdentityException.class, () ->
            credentialStore.register("bob_2", "BOB@example.com", "Str0ng!Pass", "Bob Two", null));
        assertEquals("email", byEmail.getField());
    }

    @Test
    void testWeakPasswordNamesRule() {
        WeakPasswordException e = assertThrows(WeakPasswordException.class, () ->
            credentialStore.register("carol", "carol@example.com", "weakpassword", "Carol C", null));
        assertEquals(PasswordRule.UPPERCASE, e.getRule());
        assertFalse(userRepository.existsByUsername("carol"));
    }

    @Test
    void testInvalidUsernameRejected() {
        assertThrows(IllegalArgumentException.class, () ->
            credentialStore.register("no spaces", "x@example.com", "Str0ng!Pass", "Name Here", null));
        assertThrows(IllegalArgumentException.class, () ->
            credentialStore.register("ab", "y@example.com", "Str0ng!Pass", "Name Here", null));
    }

    @Test
    void testVerifyIsUniformForEveryFailure() {
        User user = credentialStore.register("dave", "dave@example.com", "Str0ng!Pass", "Dave D", null);

        MatchResult ok = credentialStore.verify("dave", "Str0ng!Pass");
        assertTrue(ok.isOk());
        assertEquals(user.getUserId(), ok.getUserId());

        MatchResult wrongPassword = credentialStore.verify("dave", "Wr0ng!Pass");
        MatchResult unknownUser = credentialStore.verify("nobody_here", "Str0ng!Pass");
        MatchResult nullInput = credentialStore.verify(null, null);
        assertEquals(wrongPassword, unknownUser);
        assertEquals(wrongPassword, nullInput);
        assertFalse(wrongPassword.isOk());
        assertNull(wrongPassword.getUserId());
    }

    @Test
    void testInactiveUserDoesNotVerify() {
        User user = credentialStore.register("erin", "erin@example.com", "Str0ng!Pass", "Erin E", null);
        user.deactivate(user.getCreatedAt());
        userRepository.save(user);

        assertFalse(credentialStore.verify("erin", "Str0ng!Pass").isOk());
    }

    @Test
    void testRehashReplacesPassword() {
        User user = credentialStore.register("frank", "frank@example.com", "Str0ng!Pass", "Frank F", null);

        credentialStore.rehash(user.getUserId(), "N3w!Password");

        assertFalse(credentialStore.verify("frank", "Str0ng!Pass").isOk());
        assertTrue(credentialStore.verify("frank", "N3w!Password").isOk());
        assertThrows(WeakPasswordException.class, () -> credentialStore.rehash(user.getUserId(), "short"));
    }
}
