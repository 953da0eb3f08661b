package com.securebank.lockout;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only record of a login attempt. Lockout decisions are derived from these rows.
 */
@Entity
@Table(name = "login_attempts", indexes = {
    @Index(name = "idx_login_attempts_username_time", columnList = "username, attempted_at"),
    @Index(name = "idx_login_attempts_attempted_at", columnList = "attempted_at")
})
@Data
@NoArgsConstructor
public class LoginAttempt {

    public static final int MAX_USERNAME_LENGTH = 80;

    /**
     * Insertion order. Attempts for one username are inserted under that user's row lock,
     * so this breaks ties between attempts recorded at the same instant.
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long attemptId;

    @Column(nullable = false, updatable = false, length = MAX_USERNAME_LENGTH)
    private String username;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private LoginOutcome outcome;

    @Column(updatable = false, length = 45)
    private String sourceIp;

    @Column(updatable = false)
    private String userAgent;

    @Column(name = "attempted_at", nullable = false, updatable = false)
    private Instant attemptedAt;

    public LoginAttempt(String username, LoginOutcome outcome, String sourceIp,
                        String userAgent, Instant attemptedAt) {
        this.username = truncate(username, MAX_USERNAME_LENGTH);
        this.outcome = outcome;
        this.sourceIp = sourceIp;
        this.userAgent = truncate(userAgent, 255);
        this.attemptedAt = attemptedAt;
    }

    private static String truncate(String value, int max) {
        return value == null || value.length() <= max ? value : value.substring(0, max);
    }
}
