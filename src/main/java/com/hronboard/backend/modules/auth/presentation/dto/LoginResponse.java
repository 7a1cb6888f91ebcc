package com.hronboard.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record LoginResponse(
        UserResponse user,
        String token,
        UUID sessionId,
        OffsetDateTime expiresAt
) {
}
