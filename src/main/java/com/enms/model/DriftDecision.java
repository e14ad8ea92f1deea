package com.enms.model;

public enum DriftDecision {
    IGNORED,
    RETRAIN_TRIGGERED
}
