package com.securebank.api.dto;

import com.securebank.guard.Role;
import com.securebank.users.User;
import lombok.Value;

import java.time.Instant;

/**
 * Public view of a user. Never carries the password hash.
 */
@Value
public class UserResponse {
    String userId;
    String username;
    String email;
    String fullName;
    String phone;
    Role role;
    boolean active;
    int failedLoginAttempts;
    Instant lockedUntil;
    Instant lastLoginAt;
    Instant createdAt;

    public static UserResponse from(User user) {
        return new UserResponse(user.getUserId(), user.getUsername(), user.getEmail(), user.getFullName(),
            user.getPhone(), user.getRole(), user.isActive(), user.getFailedLoginAttempts(),
            user.getLockedUntil(), user.getLastLoginAt(), user.getCreatedAt());
    }
}
