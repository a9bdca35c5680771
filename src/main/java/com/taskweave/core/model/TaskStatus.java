package com.taskweave.core.model;

/**
 * Status of an individual task within a run.
 */
public enum TaskStatus {
    PENDING,
    SCHEDULED,  // dispatched, waiting for a permit
    RUNNING,
    PAUSED,     // held at the pause gate
    COMPLETED,
    FAILED,
    CANCELLED,
    TIMEOUT;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == TIMEOUT;
    }

    /**
     * True for outcomes that count as a task failure (FAILED or TIMEOUT).
     */
    public boolean isFailure() {
        return this == FAILED || this == TIMEOUT;
    }
}
