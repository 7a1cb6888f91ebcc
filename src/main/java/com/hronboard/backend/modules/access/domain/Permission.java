package com.hronboard.backend.modules.access.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Capability strings checked by route rules and services. The codes are part of the public API.
 */
public enum Permission {

    USERS_CREATE("users:create"),
    USERS_READ_ALL("users:read:all"),
    USERS_READ_OWN("users:read:own"),
    USERS_UPDATE_ALL("users:update:all"),
    USERS_UPDATE_OWN("users:update:own"),
    USERS_DELETE("users:delete"),
    USERS_ASSIGN_ROLES("users:assign_roles"),

    CHECKLISTS_CREATE("checklists:create"),
    CHECKLISTS_READ_ALL("checklists:read:all"),
    CHECKLISTS_READ_OWN("checklists:read:own"),
    CHECKLISTS_UPDATE_ALL("checklists:update:all"),
    CHECKLISTS_UPDATE_OWN("checklists:update:own"),
    CHECKLISTS_DELETE_ALL("checklists:delete:all"),
    CHECKLISTS_DELETE_OWN("checklists:delete:own"),
    CHECKLISTS_ASSIGN("checklists:assign"),

    TEMPLATES_CREATE("templates:create"),
    TEMPLATES_VIEW("templates:view"),
    TEMPLATES_READ("templates:read"),
    TEMPLATES_EDIT("templates:edit"),
    TEMPLATES_DELETE("templates:delete"),
    TEMPLATES_APPROVE("templates:approve"),
    TEMPLATES_CLONE("templates:clone"),

    ANALYTICS_VIEW("analytics:view"),
    REPORTS_GENERATE("reports:generate"),
    REPORTS_EXPORT("reports:export"),

    SYSTEM_SETTINGS("system:settings"),
    SYSTEM_LOGS("system:logs"),
    SYSTEM_BACKUP("system:backup"),

    SESSIONS_VIEW_ALL("sessions:view:all"),
    SESSIONS_VIEW_OWN("sessions:view:own"),
    SESSIONS_TERMINATE_ALL("sessions:terminate:all"),
    SESSIONS_TERMINATE_OWN("sessions:terminate:own");

    private final String code;

    Permission(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<Permission> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(permission -> permission.code.equals(code))
                .findFirst();
    }
}
