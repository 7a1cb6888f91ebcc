package com.hronboard.backend.modules.users.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

/**
 * Null fields are left untouched.
 */
public record UpdateProfileRequest(
        @Size(min = 2, max = 50) String firstName,
        @Size(min = 2, max = 50) String lastName,
        @Email(message = "email must be valid") String email,
        @Size(max = 100) String department
) {
}
