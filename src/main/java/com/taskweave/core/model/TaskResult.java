package com.taskweave.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Final outcome of one task in one run.
 *
 * @param taskId      the task this result belongs to
 * @param status      terminal status
 * @param output      value returned by the body, null when skipped or failed
 * @param error       last error, null on success
 * @param duration    time from first attempt to settlement
 * @param attempts    attempts made (0 when skipped by its condition before any attempt)
 * @param startedAt   when the first attempt began
 * @param completedAt when the task settled
 */
public record TaskResult(
    String taskId,
    TaskStatus status,
    Object output,
    Throwable error,
    Duration duration,
    int attempts,
    Instant startedAt,
    Instant completedAt
) {

    public static TaskResult completed(String taskId, Object output, int attempts, Instant startedAt, Instant completedAt) {
        return new TaskResult(taskId, TaskStatus.COMPLETED, output, null,
                Duration.between(startedAt, completedAt), attempts, startedAt, completedAt);
    }

    /** A task whose condition evaluated false: completed with no output and zero duration. */
    public static TaskResult skipped(String taskId, int attempts, Instant at) {
        return new TaskResult(taskId, TaskStatus.COMPLETED, null, null, Duration.ZERO, attempts, at, at);
    }

    public static TaskResult unsuccessful(String taskId, TaskStatus status, Throwable error, int attempts,
                                          Instant startedAt, Instant completedAt) {
        return new TaskResult(taskId, status, null, error,
                Duration.between(startedAt, completedAt), attempts, startedAt, completedAt);
    }

    public boolean isCompleted() {
        return status == TaskStatus.COMPLETED;
    }

    public <T> T outputAs(Class<T> type) {
        return type.cast(output);
    }

    public String errorMessage() {
        return error != null ? error.getMessage() : null;
    }
}
