package com.tutorflow.tutorbackend.error;

import org.springframework.http.HttpStatus;

public enum ErrorKind {
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CONFLICT(HttpStatus.CONFLICT),
    POLICY_VIOLATION(HttpStatus.UNPROCESSABLE_ENTITY),
    UNAUTHORIZED(HttpStatus.FORBIDDEN),
    EXTERNAL_PROVIDER(HttpStatus.BAD_GATEWAY),
    VALIDATION(HttpStatus.BAD_REQUEST);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
