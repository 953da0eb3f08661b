package com.securebank.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * DTO for registering a new customer.
 */
@Data
public class RegisterRequest {

    @NotBlank(message = "Username is required")
    @Size(min = 3, max = 80, message = "Username must be 3-80 characters")
    private String username;

    @NotBlank(message = "Email is required")
    @Email(message = "Email address is invalid")
    @Size(max = 120)
    private String email;

    @NotBlank(message = "Password is required")
    @Size(max = 128)
    private String password;

    @NotBlank(message = "Full name is required")
    @Size(min = 2, max = 100)
    private String fullName;

    @Size(max = 20)
    private String phone;
}
