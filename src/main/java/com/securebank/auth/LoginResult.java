package com.securebank.auth;

import com.securebank.session.IssuedSession;
import com.securebank.users.User;
import lombok.Value;

/**
 * A successful login: the user and the session issued to them.
 */
@Value
public class LoginResult {
    User user;
    IssuedSession session;
}
