package com.securebank.common.exception;

/**
 * Thrown when credentials do not verify.
 * The message is identical for unknown usernames, wrong passwords and inactive users.
 */
public class AuthenticationFailureException extends SecureBankException {

    public static final String UNIFORM_MESSAGE = "Invalid username or password";

    public AuthenticationFailureException() {
        super("AUTHENTICATION_FAILURE", UNIFORM_MESSAGE);
    }
}
