package com.securebank.guard;

import com.securebank.session.AuthenticatedSession;
import com.securebank.users.User;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Role checks for the request pipeline. Every check fails closed: anything missing or
 * inactive is denied.
 */
@Component
public class AuthorizationGuard {

    public boolean requireRole(AuthenticatedSession session, Role required) {
        if (session == null || required == null) {
            return false;
        }
        User user = session.getUser();
        if (user == null || !user.isActive() || user.getRole() == null) {
            return false;
        }
        return user.getRole().satisfies(required);
    }

    /**
     * Administrators are exempt from rate limiting.
     */
    public boolean isRateLimitExempt(Optional<AuthenticatedSession> session) {
        return session.map(s -> requireRole(s, Role.ADMIN)).orElse(false);
    }
}
