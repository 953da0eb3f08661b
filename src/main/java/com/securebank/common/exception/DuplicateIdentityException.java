package com.securebank.common.exception;

/**
 * Thrown when a username or email is already registered.
 */
public class DuplicateIdentityException extends SecureBankException {

    private final String field;

    public DuplicateIdentityException(String field) {
        super("DUPLICATE_IDENTITY", "The " + field + " is already registered");
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
