package com.securebank.common.exception;

import com.securebank.users.PasswordRule;

/**
 * Thrown when a password does not satisfy the password policy.
 * Names the first unmet rule.
 */
public class WeakPasswordException extends SecureBankException {

    private final PasswordRule rule;

    public WeakPasswordException(PasswordRule rule, String message) {
        super("WEAK_PASSWORD", message);
        this.rule = rule;
    }

    public PasswordRule getRule() {
        return rule;
    }
}
