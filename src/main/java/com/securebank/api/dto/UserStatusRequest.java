package com.securebank.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for activating or deactivating a user.
 */
@Data
public class UserStatusRequest {

    @NotNull(message = "Active flag is required")
    private Boolean active;
}
