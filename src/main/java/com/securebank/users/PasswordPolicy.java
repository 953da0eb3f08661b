package com.securebank.users;

import com.securebank.common.exception.WeakPasswordException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Password strength policy applied at registration and on every password change.
 */
@Component
public class PasswordPolicy {

    static final String SYMBOLS = "!@#$%^&*";

    private final int minLength;

    public PasswordPolicy(@Value("${secure-bank.password.min-length:8}") int minLength) {
        this.minLength = minLength;
    }

    /**
     * @throws WeakPasswordException naming the first rule the password fails
     */
    public void enforce(String rawPassword) {
        if (rawPassword == null || rawPassword.length() < minLength) {
            throw new WeakPasswordException(PasswordRule.MIN_LENGTH,
                "Password must be at least " + minLength + " characters long");
        }
        if (rawPassword.chars().noneMatch(Character::isUpperCase)) {
            throw new WeakPasswordException(PasswordRule.UPPERCASE,
                "Password must contain an uppercase letter");
        }
        if (rawPassword.chars().noneMatch(Character::isLowerCase)) {
            throw new WeakPasswordException(PasswordRule.LOWERCASE,
                "Password must contain a lowercase letter");
        }
        if (rawPassword.chars().noneMatch(Character::isDigit)) {
            throw new WeakPasswordException(PasswordRule.DIGIT,
                "Password must contain a digit");
        }
        if (rawPassword.chars().noneMatch(c -> SYMBOLS.indexOf(c) >= 0)) {
            throw new WeakPasswordException(PasswordRule.SYMBOL,
                "Password must contain a special character (" + SYMBOLS + ")");
        }
    }
}
