package com.enms.model;

public enum Severity {
    NORMAL,
    WARNING,
    CRITICAL
}
