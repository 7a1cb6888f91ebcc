package com.hronboard.backend.modules.users.presentation.dto;

import com.hronboard.backend.modules.auth.presentation.dto.UserResponse;

public record ProfileResponse(UserResponse user, Capabilities capabilities) {

    public record Capabilities(
            boolean canManageUsers,
            boolean canViewAllChecklists,
            boolean canCreateTemplates,
            boolean canViewAnalytics
    ) {
    }
}
