package com.hronboard.backend.modules.auth.presentation.dto;

import java.util.UUID;

import com.hronboard.backend.modules.auth.domain.AppUser;

/**
 * Compact reference to a user embedded in other resources.
 */
public record UserSummaryResponse(UUID id, String name, String email) {

    public static UserSummaryResponse from(AppUser user) {
        if (user == null) {
            return null;
        }
        return new UserSummaryResponse(user.getId(), user.getFullName(), user.getEmail());
    }
}
