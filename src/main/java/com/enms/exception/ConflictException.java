package com.enms.exception;

/**
 * The request conflicts with the current lifecycle state.
 */
public class ConflictException extends AnalyticsException {

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }
}
