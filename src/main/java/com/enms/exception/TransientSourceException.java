package com.enms.exception;

/**
 * Retryable failure of the time-series source (connection reset, pool exhausted, ...).
 */
public class TransientSourceException extends AnalyticsException {

    public TransientSourceException(String message) {
        super(ErrorCode.TRANSIENT_SOURCE_FAILURE, message);
    }

    public TransientSourceException(String message, Throwable cause) {
        super(ErrorCode.TRANSIENT_SOURCE_FAILURE, message, cause);
    }
}
