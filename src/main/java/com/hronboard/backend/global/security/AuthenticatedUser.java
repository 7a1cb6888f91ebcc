package com.hronboard.backend.global.security;

import java.util.UUID;

import com.hronboard.backend.modules.auth.domain.UserRole;

/**
 * Principal attached to the security context once a bearer token has been verified.
 */
public record AuthenticatedUser(UUID userId, String email, UserRole role, String department, UUID sessionId) {
}
