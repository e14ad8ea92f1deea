package com.enms.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable error codes surfaced to API callers and stored as job failure reasons.
 */
public enum ErrorCode {
    INSUFFICIENT_DRIVERS(HttpStatus.UNPROCESSABLE_ENTITY),
    INSUFFICIENT_DATA(HttpStatus.UNPROCESSABLE_ENTITY),
    NO_ACTIVE_MODEL(HttpStatus.CONFLICT),
    INSUFFICIENT_TRIAL_DATA(HttpStatus.CONFLICT),
    TIMEOUT(HttpStatus.GATEWAY_TIMEOUT),
    NO_DATA(HttpStatus.NOT_FOUND),
    CANCELLED(HttpStatus.CONFLICT),
    INVALID_STATE_TRANSITION(HttpStatus.CONFLICT),
    CONFLICT(HttpStatus.CONFLICT),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_READING(HttpStatus.BAD_REQUEST),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST),
    TRANSIENT_SOURCE_FAILURE(HttpStatus.SERVICE_UNAVAILABLE),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
