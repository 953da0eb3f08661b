package com.securebank.common.exception;

/**
 * Thrown when ciphertext cannot be authenticated or decrypted.
 * Treated as a data-integrity fault; callers only ever see a generic failure.
 */
public class DecryptionException extends SecureBankException {

    public DecryptionException(String message, Throwable cause) {
        super("DECRYPTION_ERROR", message, cause);
    }
}
