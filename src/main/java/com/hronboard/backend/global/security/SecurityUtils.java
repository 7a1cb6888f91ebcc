package com.hronboard.backend.global.security;

import java.util.Optional;
import java.util.UUID;

import com.hronboard.backend.global.error.ProblemException;
import com.hronboard.backend.global.error.ProblemKind;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static AuthenticatedUser getCurrentPrincipal() {
        return findCurrentPrincipal()
                .orElseThrow(() -> new ProblemException(ProblemKind.UNAUTHORIZED, "auth.required", "Authentication required"));
    }

    /**
     * Empty on anonymous requests, e.g. public registration.
     */
    public static Optional<AuthenticatedUser> findCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof AuthenticatedUser principal) {
            return Optional.of(principal);
        }
        return Optional.empty();
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }
}
