package com.enms.model;

public enum AbTestStatus {
    RUNNING,
    DECIDED
}
