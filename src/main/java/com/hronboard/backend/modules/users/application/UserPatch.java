package com.hronboard.backend.modules.users.application;

import com.hronboard.backend.modules.auth.domain.UserRole;

/**
 * Partial account update. A null component means "leave as is".
 */
public record UserPatch(
        String firstName,
        String lastName,
        String email,
        String department,
        UserRole role,
        Boolean active
) {

    public boolean isEmpty() {
        return firstName == null
                && lastName == null
                && email == null
                && department == null
                && role == null
                && active == null;
    }
}
