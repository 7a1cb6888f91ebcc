package com.hronboard.backend.modules.template.domain;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TemplateStatus {

    DRAFT("draft"),
    PENDING_APPROVAL("pending_approval"),
    APPROVED("approved"),
    ARCHIVED("archived");

    private final String code;

    TemplateStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isEditable() {
        return this == DRAFT;
    }

    public boolean isArchivable() {
        return this == DRAFT || this == APPROVED;
    }

    @JsonCreator
    public static TemplateStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(status -> status.code.equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown template status: " + code));
    }
}
