package com.securebank.common.exception;

/**
 * Thrown when a request exceeds a rate limit tier.
 */
public class RateLimitExceededException extends SecureBankException {

    private final long limit;
    private final long retryAfterSeconds;

    public RateLimitExceededException(long limit, long retryAfterSeconds) {
        super("RATE_LIMIT_EXCEEDED", "Too many requests");
        this.limit = limit;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getLimit() {
        return limit;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
