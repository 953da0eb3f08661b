package com.securebank.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * DTO for reversing a transfer.
 */
@Data
public class ReversalRequest {

    @NotBlank(message = "Reason is required")
    @Size(max = 500)
    private String reason;
}
