package com.enms.model;

/**
 * What asked for a retraining job.
 */
public enum RetrainTrigger {
    MANUAL,
    SCHEDULED,
    DRIFT
}
