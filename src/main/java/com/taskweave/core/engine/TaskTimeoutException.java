package com.taskweave.core.engine;

import java.time.Duration;

/**
 * Raised when a task attempt outlives its timeout.
 */
public class TaskTimeoutException extends RuntimeException {

    private final String taskId;
    private final Duration timeout;

    public TaskTimeoutException(String taskId, Duration timeout) {
        super("Task timeout after " + timeout.toMillis() + "ms");
        this.taskId = taskId;
        this.timeout = timeout;
    }

    public String getTaskId() {
        return taskId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
