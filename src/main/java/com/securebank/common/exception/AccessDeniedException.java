package com.securebank.common.exception;

/**
 * Thrown when a session lacks the role required for an operation.
 */
public class AccessDeniedException extends SecureBankException {

    public AccessDeniedException(String message) {
        super("ACCESS_DENIED", message);
    }
}
