package com.securebank.api.dto;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class AccountsSummaryResponse {
    List<AccountResponse> accounts;
    BigDecimal totalBalance;
}
