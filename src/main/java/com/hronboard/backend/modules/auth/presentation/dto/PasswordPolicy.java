package com.hronboard.backend.modules.auth.presentation.dto;

/**
 * Shared password rule for registration and password change.
 */
public final class PasswordPolicy {

    public static final String PATTERN = "^(?=.*[a-z])(?=.*[A-Z])(?=.*\\d)(?=.*[@$!%*?&])[A-Za-z\\d@$!%*?&]{8,}$";
    public static final String MESSAGE =
            "password must be at least 8 characters with an uppercase letter, a lowercase letter, a number and one of @$!%*?&";

    private PasswordPolicy() {
    }
}
