package com.securepad.portal.error;

import org.springframework.http.HttpStatus;

public enum ErrorKind {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    AUTHENTICATION_REQUIRED(HttpStatus.UNAUTHORIZED),
    AUTHORIZATION_ERROR(HttpStatus.FORBIDDEN),
    DUPLICATE_SUBMISSION(HttpStatus.CONFLICT),
    ALREADY_CHALLENGED(HttpStatus.CONFLICT),
    NO_PENDING_CHALLENGE(HttpStatus.CONFLICT),
    INACTIVE_ASSESSMENT(HttpStatus.BAD_REQUEST),
    ASSESSMENT_LOCKED(HttpStatus.CONFLICT),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
