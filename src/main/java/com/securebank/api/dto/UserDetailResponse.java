package com.securebank.api.dto;

import com.securebank.admin.UserDetail;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Value
public class UserDetailResponse {
    UserResponse user;
    List<AccountResponse> accounts;
    boolean locked;
    int recentFailures;
    Instant lockedUntil;
    List<LoginAttemptResponse> recentAttempts;

    public static UserDetailResponse from(UserDetail detail, Instant now) {
        return new UserDetailResponse(
            UserResponse.from(detail.getUser()),
            detail.getAccounts().stream().map(AccountResponse::from).collect(Collectors.toList()),
            detail.getLockoutState().isLockedAt(now),
            detail.getLockoutState().getFailureCount(),
            detail.getLockoutState().getLockedUntil(),
            detail.getRecentAttempts().stream().map(LoginAttemptResponse::from).collect(Collectors.toList()));
    }
}
