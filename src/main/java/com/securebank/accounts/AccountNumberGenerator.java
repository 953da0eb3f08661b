package com.securebank.accounts;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Draws unused 10-digit account numbers from a cryptographically secure source.
 */
@Component
@RequiredArgsConstructor
public class AccountNumberGenerator {

    static final int DIGITS = 10;
    private static final int MAX_ATTEMPTS = 20;
    private static final long BOUND = 10_000_000_000L;

    private final SecureRandom secureRandom;
    private final AccountRepository accountRepository;

    public String next() {
        for (int i = 0; i < MAX_ATTEMPTS; i++) {
            String candidate = String.format("%0" + DIGITS + "d", secureRandom.nextLong(BOUND));
            if (!accountRepository.existsByAccountNumber(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Unable to allocate a unique account number");
    }

    public static boolean isWellFormed(String accountNumber) {
        if (accountNumber == null || accountNumber.length() != DIGITS) {
            return false;
        }
        for (int i = 0; i < DIGITS; i++) {
            char c = accountNumber.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
