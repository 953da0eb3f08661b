package com.securebank.common.exception;

/**
 * Thrown when the presented session has passed its idle or absolute expiry.
 */
public class SessionExpiredException extends SecureBankException {

    public SessionExpiredException() {
        super("SESSION_EXPIRED", "Session expired");
    }
}
