package com.enms.exception;

/**
 * Raised when a lifecycle record is asked to move to a state its state machine forbids.
 */
public class IllegalStateTransitionException extends AnalyticsException {

    public IllegalStateTransitionException(String message) {
        super(ErrorCode.INVALID_STATE_TRANSITION, message);
    }
}
