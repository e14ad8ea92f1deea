package com.enms.model;

/**
 * Lifecycle status of a baseline model. At most one ACTIVE and at most one
 * CHALLENGER per machine.
 */
public enum ModelStatus {
    TRAINING,
    ACTIVE,
    CHALLENGER,
    RETIRED
}
