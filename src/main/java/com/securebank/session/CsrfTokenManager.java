package com.securebank.session;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Issues per-session anti-forgery tokens and checks them on state-changing requests.
 */
@Component
@RequiredArgsConstructor
public class CsrfTokenManager {

    private static final int TOKEN_BYTES = 32;

    private final SecureRandom secureRandom;

    public String issue() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Constant-time comparison of the supplied token against the one bound to the session.
     */
    public boolean validate(AuthenticatedSession session, String suppliedToken) {
        if (session == null || session.getCsrfToken() == null
                || suppliedToken == null || suppliedToken.isBlank()) {
            return false;
        }
        return MessageDigest.isEqual(
            session.getCsrfToken().getBytes(StandardCharsets.UTF_8),
            suppliedToken.getBytes(StandardCharsets.UTF_8));
    }
}
