package com.hronboard.backend.modules.access.application;

import java.util.Arrays;
import java.util.Set;
import java.util.UUID;

import com.hronboard.backend.global.security.AuthenticatedUser;
import com.hronboard.backend.modules.access.domain.OwnedResource;
import com.hronboard.backend.modules.access.domain.Permission;
import com.hronboard.backend.modules.access.domain.ResourceAccess;
import com.hronboard.backend.modules.access.domain.RolePermissions;
import com.hronboard.backend.modules.auth.domain.UserRole;

import org.springframework.stereotype.Component;

/**
 * Pure permission decisions. Nothing here touches the database or the request.
 */
@Component
public class AccessPolicy {

    public enum UserAction {
        VIEW,
        EDIT,
        DELETE,
        ASSIGN_ROLE
    }

    public Set<Permission> permissionsOf(UserRole role) {
        return RolePermissions.of(role);
    }

    public boolean hasPermission(UserRole role, Permission permission) {
        return permission != null && RolePermissions.of(role).contains(permission);
    }

    /**
     * Unknown roles or capability strings are simply denied.
     */
    public boolean hasPermission(UserRole role, String capability) {
        return Permission.fromCode(capability)
                .map(permission -> hasPermission(role, permission))
                .orElse(false);
    }

    public boolean hasAnyPermission(UserRole role, Permission... permissions) {
        return Arrays.stream(permissions).anyMatch(permission -> hasPermission(role, permission));
    }

    public boolean hasAllPermissions(UserRole role, Permission... permissions) {
        return Arrays.stream(permissions).allMatch(permission -> hasPermission(role, permission));
    }

    public boolean isAdmin(UserRole role) {
        return hasAnyPermission(role, Permission.SYSTEM_SETTINGS, Permission.USERS_DELETE, Permission.USERS_ASSIGN_ROLES);
    }

    public boolean isHrOrAdmin(UserRole role) {
        return hasAnyPermission(role, Permission.USERS_READ_ALL, Permission.CHECKLISTS_ASSIGN, Permission.REPORTS_GENERATE);
    }

    public boolean canAccessResource(AuthenticatedUser user, OwnedResource resource, ResourceAccess mode) {
        if (user == null) {
            return mode == ResourceAccess.PUBLIC;
        }
        return switch (mode) {
            case PUBLIC -> true;
            case AUTHENTICATED -> user.userId() != null;
            case OWNER -> resource != null && user.userId() != null && user.userId().equals(resource.getOwnerId());
            case DEPARTMENT -> resource != null
                    && resource.getOwnerDepartment() != null
                    && resource.getOwnerDepartment().equals(user.department());
            case HR_PLUS -> user.role() != null && user.role().isHrOrAdmin();
            case ADMIN -> user.role() == UserRole.ADMIN;
        };
    }

    public boolean isRoleHigherOrEqual(UserRole first, UserRole second) {
        int firstRank = first == null ? 0 : first.getRank();
        int secondRank = second == null ? 0 : second.getRank();
        return firstRank >= secondRank;
    }

    public boolean canAssignRole(UserRole assigner, UserRole target) {
        if (assigner == null || target == null) {
            return false;
        }
        if (target == UserRole.ADMIN) {
            return assigner == UserRole.ADMIN;
        }
        return assigner.isHrOrAdmin();
    }

    /**
     * Self access is always allowed for viewing and editing one's own account.
     */
    public boolean canAccessUser(AuthenticatedUser actor, UUID targetUserId, UserAction action) {
        if (actor == null) {
            return false;
        }
        boolean self = actor.userId() != null && actor.userId().equals(targetUserId);
        return switch (action) {
            case VIEW -> self || hasPermission(actor.role(), Permission.USERS_READ_ALL);
            case EDIT -> self || hasPermission(actor.role(), Permission.USERS_UPDATE_ALL);
            case DELETE -> hasPermission(actor.role(), Permission.USERS_DELETE);
            case ASSIGN_ROLE -> hasPermission(actor.role(), Permission.USERS_ASSIGN_ROLES);
        };
    }
}
