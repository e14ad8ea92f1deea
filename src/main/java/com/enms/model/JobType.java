package com.enms.model;

/**
 * Periodic job types driven by the analytics scheduler. Each type has its own
 * mutual-exclusion guard and persisted run state.
 */
public enum JobType {
    ANOMALY_SCAN,
    DRIFT_CHECK,
    SCHEDULED_RETRAIN,
    AB_EVALUATION
}
