package com.hronboard.backend.modules.auth.presentation.dto;

import com.hronboard.backend.modules.auth.domain.UserRole;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "email is required") @Email(message = "email must be valid") String email,
        @NotBlank(message = "password is required")
        @Pattern(regexp = PasswordPolicy.PATTERN, message = PasswordPolicy.MESSAGE) String password,
        @NotBlank(message = "firstName is required") @Size(min = 2, max = 50) String firstName,
        @NotBlank(message = "lastName is required") @Size(min = 2, max = 50) String lastName,
        UserRole role,
        @Size(max = 100) String department
) {
}
