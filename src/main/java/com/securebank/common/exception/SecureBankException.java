package com.securebank.common.exception;

/**
 * Base exception for all secure bank core exceptions.
 * Carries a stable error code that the API layer reports to callers.
 */
public class SecureBankException extends RuntimeException {

    private final String errorCode;

    public SecureBankException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SecureBankException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
