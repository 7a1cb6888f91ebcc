package com.hronboard.backend.modules.access.domain;

public enum ResourceAccess {

    PUBLIC("public"),
    AUTHENTICATED("authenticated"),
    OWNER("owner"),
    DEPARTMENT("department"),
    HR_PLUS("hr_plus"),
    ADMIN("admin");

    private final String code;

    ResourceAccess(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
