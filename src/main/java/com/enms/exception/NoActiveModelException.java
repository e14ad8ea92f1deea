package com.enms.exception;

/**
 * The machine has no active baseline model to score or evaluate against.
 */
public class NoActiveModelException extends AnalyticsException {

    public NoActiveModelException(String message) {
        super(ErrorCode.NO_ACTIVE_MODEL, message);
    }
}
