package com.securebank.session;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;

/**
 * Server-side session state. The opaque token handed to the client is never stored; the
 * session is keyed by its SHA-256 digest.
 */
@Entity
@Table(name = "user_sessions", indexes = {
    @Index(name = "idx_user_sessions_user", columnList = "user_id"),
    @Index(name = "idx_user_sessions_expires", columnList = "expires_at")
})
@Data
@NoArgsConstructor
public class UserSession {

    @Id
    @Column(length = 64)
    private String sessionId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @ToString.Exclude
    @Column(nullable = false, updatable = false, length = 64)
    private String csrfToken;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant lastActivityAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(nullable = false, updatable = false)
    private Instant absoluteExpiresAt;

    @Column(length = 45, updatable = false)
    private String sourceIp;

    public UserSession(String sessionId, String userId, String csrfToken, String sourceIp,
                       Instant now, Duration idleTimeout, Duration absoluteTimeout) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.csrfToken = csrfToken;
        this.sourceIp = sourceIp;
        this.createdAt = now;
        this.absoluteExpiresAt = now.plus(absoluteTimeout);
        touch(now, idleTimeout);
    }

    /**
     * Slide the idle expiry forward, never past the absolute expiry.
     */
    public void touch(Instant now, Duration idleTimeout) {
        Instant idleExpiry = now.plus(idleTimeout);
        this.lastActivityAt = now;
        this.expiresAt = idleExpiry.isAfter(absoluteExpiresAt) ? absoluteExpiresAt : idleExpiry;
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
