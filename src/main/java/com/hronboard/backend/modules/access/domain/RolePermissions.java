package com.hronboard.backend.modules.access.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import com.hronboard.backend.modules.auth.domain.UserRole;

/**
 * Fixed role to capability table.
 */
public final class RolePermissions {

    private static final Map<UserRole, Set<Permission>> TABLE = Map.of(
            UserRole.ADMIN, Collections.unmodifiableSet(EnumSet.allOf(Permission.class)),
            UserRole.HR_MANAGER, Collections.unmodifiableSet(hrManager()),
            UserRole.EMPLOYEE, Collections.unmodifiableSet(employee())
    );

    private RolePermissions() {
    }

    public static Set<Permission> of(UserRole role) {
        if (role == null) {
            return Set.of();
        }
        return TABLE.getOrDefault(role, Set.of());
    }

    private static Set<Permission> hrManager() {
        Set<Permission> permissions = EnumSet.allOf(Permission.class);
        permissions.removeAll(EnumSet.of(
                Permission.USERS_DELETE,
                Permission.USERS_ASSIGN_ROLES,
                Permission.SYSTEM_SETTINGS,
                Permission.SYSTEM_LOGS,
                Permission.SYSTEM_BACKUP,
                Permission.SESSIONS_VIEW_ALL,
                Permission.SESSIONS_TERMINATE_ALL
        ));
        return permissions;
    }

    private static Set<Permission> employee() {
        return EnumSet.of(
                Permission.USERS_READ_OWN,
                Permission.USERS_UPDATE_OWN,
                Permission.CHECKLISTS_READ_OWN,
                Permission.CHECKLISTS_UPDATE_OWN,
                Permission.TEMPLATES_VIEW,
                Permission.TEMPLATES_READ,
                Permission.SESSIONS_VIEW_OWN,
                Permission.SESSIONS_TERMINATE_OWN
        );
    }
}
