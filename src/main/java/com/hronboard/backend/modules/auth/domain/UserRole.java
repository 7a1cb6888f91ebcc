package com.hronboard.backend.modules.auth.domain;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The three fixed account roles. {@code rank} orders them for hierarchy checks.
 */
public enum UserRole {

    ADMIN("admin", 3),
    HR_MANAGER("hr_manager", 2),
    EMPLOYEE("employee", 1);

    private final String code;
    private final int rank;

    UserRole(String code, int rank) {
        this.code = code;
        this.rank = rank;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getRank() {
        return rank;
    }

    public boolean isHrOrAdmin() {
        return this == ADMIN || this == HR_MANAGER;
    }

    @JsonCreator
    public static UserRole fromCode(String code) {
        return Arrays.stream(values())
                .filter(role -> role.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + code));
    }
}
