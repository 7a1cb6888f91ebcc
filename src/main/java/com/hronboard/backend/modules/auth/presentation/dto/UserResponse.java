package com.hronboard.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.hronboard.backend.modules.auth.domain.AppUser;
import com.hronboard.backend.modules.auth.domain.UserRole;

/**
 * Sanitized view of an account: no password hash, no lockout bookkeeping.
 */
public record UserResponse(
        UUID id,
        String email,
        String firstName,
        String lastName,
        UserRole role,
        String department,
        boolean emailVerified,
        boolean active,
        OffsetDateTime lastLoginAt,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static UserResponse from(AppUser user) {
        return new UserResponse(
                user.getId(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.getRole(),
                user.getDepartment(),
                user.isEmailVerified(),
                user.isActive(),
                user.getLastLoginAt(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
