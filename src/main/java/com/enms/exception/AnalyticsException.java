package com.enms.exception;

/**
 * Base class for every failure the model-lifecycle core reports.
 * Each subclass pins one {@link ErrorCode}.
 */
public abstract class AnalyticsException extends RuntimeException {

    private final ErrorCode code;

    protected AnalyticsException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected AnalyticsException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
