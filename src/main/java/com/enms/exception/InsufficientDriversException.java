package com.enms.exception;

/**
 * Raised when a baseline is requested on fewer drivers than configured.
 */
public class InsufficientDriversException extends AnalyticsException {

    public InsufficientDriversException(String message) {
        super(ErrorCode.INSUFFICIENT_DRIVERS, message);
    }
}
