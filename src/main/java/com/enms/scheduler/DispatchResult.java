package com.enms.scheduler;

public enum DispatchResult {
    SUBMITTED,
    // previous invocation of the same job type still running
    SKIPPED,
    // worker pool refused the task
    REJECTED
}
