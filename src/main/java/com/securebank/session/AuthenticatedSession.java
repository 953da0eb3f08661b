package com.securebank.session;

import com.securebank.users.User;
import lombok.ToString;
import lombok.Value;

/**
 * A validated session and the user it belongs to, as seen by the request pipeline.
 */
@Value
public class AuthenticatedSession {
    String sessionId;
    User user;

    @ToString.Exclude
    String csrfToken;

    public String getUserId() {
        return user.getUserId();
    }
}
