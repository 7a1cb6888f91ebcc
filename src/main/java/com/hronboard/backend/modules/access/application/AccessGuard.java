package com.hronboard.backend.modules.access.application;

import java.util.UUID;

import com.hronboard.backend.global.error.ProblemException;
import com.hronboard.backend.global.error.ProblemKind;
import com.hronboard.backend.global.security.AuthenticatedUser;
import com.hronboard.backend.modules.access.application.AccessPolicy.UserAction;
import com.hronboard.backend.modules.access.domain.OwnedResource;
import com.hronboard.backend.modules.access.domain.Permission;
import com.hronboard.backend.modules.access.domain.ResourceAccess;
import com.hronboard.backend.modules.auth.domain.UserRole;

import org.springframework.stereotype.Component;

/**
 * Throwing counterparts of {@link AccessPolicy} for use inside application services.
 */
@Component
public class AccessGuard {

    private final AccessPolicy accessPolicy;

    public AccessGuard(AccessPolicy accessPolicy) {
        this.accessPolicy = accessPolicy;
    }

    public void requirePermission(AuthenticatedUser actor, Permission permission) {
        requireAuthenticated(actor);
        if (!accessPolicy.hasPermission(actor.role(), permission)) {
            throw new ProblemException(ProblemKind.FORBIDDEN, "access.insufficient_permissions",
                    "Insufficient permissions: " + permission.getCode() + " required");
        }
    }

    /**
     * Passes when the actor owns the resource or satisfies any of the fallback modes.
     */
    public void requireOwnerOr(AuthenticatedUser actor, OwnedResource resource, ResourceAccess... fallbacks) {
        requireAuthenticated(actor);
        if (accessPolicy.canAccessResource(actor, resource, ResourceAccess.OWNER)) {
            return;
        }
        for (ResourceAccess fallback : fallbacks) {
            if (accessPolicy.canAccessResource(actor, resource, fallback)) {
                return;
            }
        }
        throw new ProblemException(ProblemKind.FORBIDDEN, "access.resource_denied", "Access denied to resource");
    }

    public void requireUserAccess(AuthenticatedUser actor, UUID targetUserId, UserAction action) {
        requireAuthenticated(actor);
        if (!accessPolicy.canAccessUser(actor, targetUserId, action)) {
            throw new ProblemException(ProblemKind.FORBIDDEN, "access.user_denied",
                    "Access denied for " + action.name().toLowerCase() + " action on user");
        }
    }

    public void requireRoleAssignment(AuthenticatedUser actor, UserRole targetRole) {
        requireAuthenticated(actor);
        if (!accessPolicy.canAssignRole(actor.role(), targetRole)) {
            throw new ProblemException(ProblemKind.FORBIDDEN, "access.role_assignment_denied",
                    "Cannot assign role " + targetRole.getCode());
        }
    }

    private void requireAuthenticated(AuthenticatedUser actor) {
        if (actor == null) {
            throw new ProblemException(ProblemKind.UNAUTHORIZED, "auth.required", "Authentication required");
        }
    }
}
