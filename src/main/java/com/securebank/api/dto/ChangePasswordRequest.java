package com.securebank.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * DTO for changing the caller's own password.
 */
@Data
public class ChangePasswordRequest {

    @NotBlank(message = "Current password is required")
    @Size(max = 128)
    private String currentPassword;

    @NotBlank(message = "New password is required")
    @Size(max = 128)
    private String newPassword;
}
