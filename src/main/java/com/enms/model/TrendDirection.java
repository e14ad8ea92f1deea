package com.enms.model;

public enum TrendDirection {
    DEGRADING,
    STABLE,
    IMPROVING
}
