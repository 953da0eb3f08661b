package com.securebank.common.exception;

/**
 * Thrown when a request requires an authenticated session and none can be resolved.
 */
public class SessionNotFoundException extends SecureBankException {

    public SessionNotFoundException() {
        super("SESSION_REQUIRED", "Authentication required");
    }
}
