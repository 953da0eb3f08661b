package com.securebank.ratelimit;

/**
 * Classification of an inbound request route.
 */
public enum RouteClass {
    /**
     * Login, registration, logout and password changes. Subject to the stricter tier.
     */
    AUTHENTICATION,

    /**
     * Ordinary authenticated routes.
     */
    STANDARD,

    /**
     * Administrator-only routes.
     */
    ADMIN
}
