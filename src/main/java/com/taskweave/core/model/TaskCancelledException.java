package com.taskweave.core.model;

/**
 * Raised when a task attempt is abandoned because its run was cancelled. Never retried.
 */
public class TaskCancelledException extends RuntimeException {

    public TaskCancelledException(String message) {
        super(message);
    }
}
