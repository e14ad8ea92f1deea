package com.enms.exception;

/**
 * The time-series source has no readings for the machine in range.
 */
public class NoDataException extends AnalyticsException {

    public NoDataException(String message) {
        super(ErrorCode.NO_DATA, message);
    }
}
