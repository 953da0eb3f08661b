package com.securebank.api.dto;

import com.securebank.lockout.LoginAttempt;
import com.securebank.lockout.LoginOutcome;
import lombok.Value;

import java.time.Instant;

@Value
public class LoginAttemptResponse {
    LoginOutcome outcome;
    String sourceIp;
    String userAgent;
    Instant attemptedAt;

    public static LoginAttemptResponse from(LoginAttempt attempt) {
        return new LoginAttemptResponse(attempt.getOutcome(), attempt.getSourceIp(),
            attempt.getUserAgent(), attempt.getAttemptedAt());
    }
}
