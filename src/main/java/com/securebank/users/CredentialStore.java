package com.securebank.users;

import com.securebank.common.exception.DuplicateIdentityException;
import com.securebank.common.exception.UserNotFoundException;
import com.securebank.guard.Role;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Holds user identities and password hashes and verifies credentials.
 *
 * Raw passwords only ever pass through {@link PasswordEncoder}; they are never stored or logged.
 */
@Service
@Slf4j
public class CredentialStore {

    private static final Pattern USERNAME_PATTERN = Pattern.compile("^[A-Za-z0-9_]{3,80}$");
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final PasswordPolicy passwordPolicy;
    private final Clock clock;

    /**
     * Hash checked when the username is unknown or inactive, so that a failed verify costs the
     * same regardless of the reason.
     */
    private final String dummyHash;

    public CredentialStore(UserRepository userRepository, PasswordEncoder passwordEncoder,
                           PasswordPolicy passwordPolicy, Clock clock) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.passwordPolicy = passwordPolicy;
        this.clock = clock;
        this.dummyHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    @Transactional
    public User register(String username, String email, String rawPassword, String fullName, String phone) {
        return createUser(username, email, rawPassword, fullName, phone, Role.STANDARD);
    }

    @Transactional
    public User createUser(String username, String email, String rawPassword,
                           String fullName, String phone, Role role) {
        validateIdentity(username, email, fullName);
        passwordPolicy.enforce(rawPassword);

        String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);
        if (userRepository.existsByUsername(username)) {
            throw new DuplicateIdentityException("username");
        }
        if (userRepository.existsByEmail(normalizedEmail)) {
            throw new DuplicateIdentityException("email");
        }

        User user = new User(username, normalizedEmail, passwordEncoder.encode(rawPassword),
            fullName.trim(), phone, role, clock.instant());
        try {
            userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // lost a race with a concurrent registration of the same identity
            throw new DuplicateIdentityException("username or email");
        }

        log.info("Registered {} user {} ({})", role, user.getUserId(), username);
        return user;
    }

    /**
     * Verify a username/password pair. Unknown, inactive and wrong-password cases are
     * indistinguishable to the caller.
     */
    @Transactional(readOnly = true)
    public MatchResult verify(String username, String rawPassword) {
        if (username == null || rawPassword == null) {
            passwordEncoder.matches("", dummyHash);
            return MatchResult.noMatch();
        }

        Optional<User> user = userRepository.findByUsername(username);
        if (user.isEmpty() || !user.get().isActive()) {
            passwordEncoder.matches(rawPassword, dummyHash);
            return MatchResult.noMatch();
        }

        if (passwordEncoder.matches(rawPassword, user.get().getPasswordHash())) {
            return MatchResult.matched(user.get().getUserId());
        }
        return MatchResult.noMatch();
    }

    /**
     * Replace a user's password hash. The only path through which a hash changes.
     */
    @Transactional
    public void rehash(String userId, String rawPassword) {
        passwordPolicy.enforce(rawPassword);
        User user = getUser(userId);
        user.changePasswordHash(passwordEncoder.encode(rawPassword), clock.instant());
        userRepository.save(user);
        log.info("Password re-hashed for user {}", userId);
    }

    @Transactional(readOnly = true)
    public User getUser(String userId) {
        return userRepository.findById(userId)
            .orElseThrow(() -> new UserNotFoundException(userId));
    }

    private static void validateIdentity(String username, String email, String fullName) {
        if (username == null || !USERNAME_PATTERN.matcher(username).matches()) {
            throw new IllegalArgumentException(
                "Username must be 3-80 characters of letters, digits and underscores");
        }
        if (email == null || !EMAIL_PATTERN.matcher(email.trim()).matches()) {
            throw new IllegalArgumentException("Email address is invalid");
        }
        if (fullName == null || fullName.trim().length() < 2) {
            throw new IllegalArgumentException("Full name is required");
        }
    }
}
