package com.securebank.api.dto;

import lombok.Value;

/**
 * The current user and the CSRF token to echo on state-changing requests.
 */
@Value
public class SessionResponse {
    UserResponse user;
    String csrfToken;
}
