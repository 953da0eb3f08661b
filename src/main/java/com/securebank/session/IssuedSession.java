package com.securebank.session;

import lombok.ToString;
import lombok.Value;

/**
 * A newly created session together with the raw token. The token exists only here and in the
 * client's cookie.
 */
@Value
public class IssuedSession {
    @ToString.Exclude
    String token;

    UserSession session;
}
