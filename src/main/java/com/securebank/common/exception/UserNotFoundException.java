package com.securebank.common.exception;

/**
 * Thrown when a user is not found.
 */
public class UserNotFoundException extends SecureBankException {

    public UserNotFoundException(String userId) {
        super("NOT_FOUND", "User not found: " + userId);
    }
}
