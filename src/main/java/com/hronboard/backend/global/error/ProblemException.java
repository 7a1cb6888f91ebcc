package com.hronboard.backend.global.error;

import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:hr-onboarding:";

    private final ProblemKind kind;
    private final String code;
    private final String detail;
    private final String type;

    public ProblemException(ProblemKind kind, String detail) {
        this(kind, kind.getDefaultCode(), detail);
    }

    public ProblemException(ProblemKind kind, String code, String detail) {
        super(kind.getStatus(), code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.kind = kind;
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        String normalized = code.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
        this.type = DEFAULT_TYPE_PREFIX + normalized;
    }

    public ProblemKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }
}
