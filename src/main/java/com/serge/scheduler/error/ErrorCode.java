package com.serge.scheduler.error;

import graphql.ErrorClassification;
import org.springframework.http.HttpStatus;

/**
 * Stable, client-facing error codes. Clients branch on these, so never rename a constant.
 */
public enum ErrorCode implements ErrorClassification {
    BAD_USER_INPUT(HttpStatus.BAD_REQUEST),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CONFLICT(HttpStatus.CONFLICT),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
