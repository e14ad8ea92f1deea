package com.enms.exception;

/**
 * An A/B trial ended with too few samples on at least one arm.
 */
public class InsufficientTrialDataException extends AnalyticsException {

    public InsufficientTrialDataException(String message) {
        super(ErrorCode.INSUFFICIENT_TRIAL_DATA, message);
    }
}
