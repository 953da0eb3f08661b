package com.securebank.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;

/**
 * DTO for an administrative deposit.
 */
@Data
public class DepositRequest {

    @NotNull(message = "Amount is required")
    private BigDecimal amount;

    @Size(max = 500)
    private String description;
}
