package com.enms.model;

public enum JobOutcome {
    SUCCEEDED,
    FAILED
}
