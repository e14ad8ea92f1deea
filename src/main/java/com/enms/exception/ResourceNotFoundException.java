package com.enms.exception;

/**
 * Lookup by id found nothing.
 */
public class ResourceNotFoundException extends AnalyticsException {

    public ResourceNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
