package com.securebank.admin;

import com.securebank.accounts.Account;
import com.securebank.lockout.LockoutState;
import com.securebank.lockout.LoginAttempt;
import com.securebank.users.User;
import lombok.Value;

import java.util.List;

/**
 * A user with their accounts, current lock state and most recent login attempts.
 */
@Value
public class UserDetail {
    User user;
    List<Account> accounts;
    LockoutState lockoutState;
    List<LoginAttempt> recentAttempts;
}
