package com.securebank.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * DTO for logging in.
 */
@Data
public class LoginRequest {

    @NotBlank(message = "Username is required")
    @Size(max = 120)
    private String username;

    @NotBlank(message = "Password is required")
    @Size(max = 128)
    private String password;
}
