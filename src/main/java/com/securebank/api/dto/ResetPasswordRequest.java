package com.securebank.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * DTO for an administrator setting a user's password.
 */
@Data
public class ResetPasswordRequest {

    @NotBlank(message = "New password is required")
    @Size(max = 128)
    private String newPassword;
}
