package com.securebank.users;

/**
 * Individual requirements of the password policy, in the order they are checked.
 */
public enum PasswordRule {
    MIN_LENGTH,
    UPPERCASE,
    LOWERCASE,
    DIGIT,
    SYMBOL
}
