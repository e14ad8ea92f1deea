package com.enms.exception;

/**
 * A reading cannot be scored, typically because a model driver is missing.
 */
public class InvalidReadingException extends AnalyticsException {

    public InvalidReadingException(String message) {
        super(ErrorCode.INVALID_READING, message);
    }
}
