package com.securebank.guard;

/**
 * Roles a user can hold.
 */
public enum Role {
    /**
     * Regular customer: own accounts and transfers only.
     */
    STANDARD,

    /**
     * Administrator: admin routes and rate-limit exemption.
     */
    ADMIN;

    /**
     * Whether holding this role satisfies a requirement for {@code required}.
     */
    public boolean satisfies(Role required) {
        return this == required || this == ADMIN;
    }
}
