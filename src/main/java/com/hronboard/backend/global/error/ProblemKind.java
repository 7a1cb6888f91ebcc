package com.hronboard.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Closed set of failure kinds the API reports. Each kind maps to exactly one HTTP status.
 */
public enum ProblemKind {

    CONFLICT(HttpStatus.CONFLICT, "conflict"),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "invalid_credentials"),
    ACCOUNT_LOCKED(HttpStatus.LOCKED, "account_locked"),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "unauthorized"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "forbidden"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "not_found"),
    NO_APPROVER_AVAILABLE(HttpStatus.BAD_REQUEST, "no_approver_available"),
    VALIDATION_FAILED(HttpStatus.BAD_REQUEST, "validation_failed");

    private final HttpStatus status;
    private final String defaultCode;

    ProblemKind(HttpStatus status, String defaultCode) {
        this.status = status;
        this.defaultCode = defaultCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getDefaultCode() {
        return defaultCode;
    }
}
