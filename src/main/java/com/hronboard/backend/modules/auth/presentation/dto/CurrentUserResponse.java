package com.hronboard.backend.modules.auth.presentation.dto;

import java.util.List;
import java.util.UUID;

public record CurrentUserResponse(UserResponse user, List<String> permissions, UUID sessionId) {
}
