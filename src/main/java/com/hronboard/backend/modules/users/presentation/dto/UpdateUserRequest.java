package com.hronboard.backend.modules.users.presentation.dto;

import com.hronboard.backend.modules.auth.domain.UserRole;
import com.hronboard.backend.modules.users.application.UserPatch;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

public record UpdateUserRequest(
        @Size(min = 2, max = 50) String firstName,
        @Size(min = 2, max = 50) String lastName,
        @Email(message = "email must be valid") String email,
        @Size(max = 100) String department,
        UserRole role,
        Boolean isActive
) {

    public UserPatch toPatch() {
        return new UserPatch(firstName, lastName, email, department, role, isActive);
    }
}
