package com.taskweave.core.model;

/**
 * Best-effort rollback for a task. {@code output} is null when the task itself failed.
 */
@FunctionalInterface
public interface TaskCompensation {

    void compensate(Object input, Object output, TaskContext context) throws Exception;
}
