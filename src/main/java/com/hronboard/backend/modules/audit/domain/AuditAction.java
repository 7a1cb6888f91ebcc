package com.hronboard.backend.modules.audit.domain;

public enum AuditAction {
    LOGIN_SUCCEEDED,
    ACCOUNT_LOCKED,
    LOGOUT,
    SESSION_TERMINATED,
    PASSWORD_CHANGED,
    USER_UPDATED,
    USER_DEACTIVATED,
    TEMPLATE_SUBMITTED,
    TEMPLATE_APPROVED,
    TEMPLATE_REJECTED,
    TEMPLATE_ARCHIVED,
    TEMPLATE_DELETED,
    CHECKLIST_SHARED
}
