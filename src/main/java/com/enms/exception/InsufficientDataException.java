package com.enms.exception;

/**
 * Not enough usable buckets to fit or evaluate a model.
 */
public class InsufficientDataException extends AnalyticsException {

    public InsufficientDataException(String message) {
        super(ErrorCode.INSUFFICIENT_DATA, message);
    }

    public InsufficientDataException(String message, Throwable cause) {
        super(ErrorCode.INSUFFICIENT_DATA, message, cause);
    }
}
