package com.enms.model;

/**
 * Retrain job states. Transitions only move forward:
 * QUEUED -> RUNNING -> {COMPLETED | FAILED}, plus QUEUED -> FAILED for cancellation.
 */
public enum RetrainJobState {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean canTransitionTo(RetrainJobState next) {
        return switch (this) {
            case QUEUED -> next == RUNNING || next == FAILED;
            case RUNNING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
