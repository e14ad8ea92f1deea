package com.enms.model;

public enum AlertSource {
    DRIFT,
    ANOMALY
}
