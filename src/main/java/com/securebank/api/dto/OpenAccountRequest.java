package com.securebank.api.dto;

import com.securebank.accounts.AccountType;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for opening an account.
 */
@Data
public class OpenAccountRequest {

    @NotNull(message = "Account type is required")
    private AccountType accountType;
}
