package com.securebank.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;

/**
 * DTO for a transfer. Amount rules (positive, two decimals, ceiling) are enforced by the
 * transfer service so that they are reported as typed declines.
 */
@Data
public class TransferRequest {

    @NotBlank(message = "Source account is required")
    private String sourceAccountId;

    @NotBlank(message = "Destination account number is required")
    private String destinationAccountNumber;

    @NotNull(message = "Amount is required")
    private BigDecimal amount;

    @Size(max = 500)
    private String description;
}
