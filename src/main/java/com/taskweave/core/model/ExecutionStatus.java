package com.taskweave.core.model;

/**
 * Final status of a run.
 */
public enum ExecutionStatus {
    COMPLETED,
    FAILED,
    CANCELLED,
    TIMEOUT
}
