package com.securebank.users;

import lombok.Value;

/**
 * Outcome of a credential check. Carries no information about why a check failed.
 */
@Value
public class MatchResult {
    boolean ok;
    String userId;

    public static MatchResult matched(String userId) {
        return new MatchResult(true, userId);
    }

    public static MatchResult noMatch() {
        return new MatchResult(false, null);
    }
}
