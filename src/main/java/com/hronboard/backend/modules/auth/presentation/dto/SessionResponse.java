package com.hronboard.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record SessionResponse(
        UUID id,
        String ipAddress,
        String userAgent,
        OffsetDateTime createdAt,
        OffsetDateTime expiresAt,
        boolean current
) {
}
