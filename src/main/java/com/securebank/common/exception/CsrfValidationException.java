package com.securebank.common.exception;

/**
 * Thrown when a state-changing request lacks a valid CSRF token.
 */
public class CsrfValidationException extends SecureBankException {

    public CsrfValidationException() {
        super("CSRF_VALIDATION_FAILURE", "CSRF token missing or invalid");
    }
}
