package com.securebank.api.dto;

import com.securebank.accounts.AccountStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for enabling or disabling an account.
 */
@Data
public class AccountStatusRequest {

    @NotNull(message = "Status is required")
    private AccountStatus status;
}
