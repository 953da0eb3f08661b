package com.securebank.admin;

import com.securebank.common.Money;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time statistics for the administration dashboard.
 */
@Value
@Builder
public class SystemOverview {
    long totalUsers;
    long activeUsers;
    long lockedUsers;
    long failedLoginsToday;
    long totalAccounts;
    long totalTransactions;
    long failedTransactions;
    Money totalBalance;
}
