package com.taskweave.core.model;

/**
 * Scheduling discipline for the tasks of a plan.
 * <p>
 * SEQUENTIAL: one task at a time in plan order, each output feeding the next input.
 * PARALLEL: every task at once with the same input.
 * RACE: every task at once, the first to settle wins and the rest are abandoned.
 * ALL: every task at once, completed tasks are compensated if any sibling fails.
 * DAG: tasks dispatched as their dependencies complete.
 */
public enum ExecutionStrategy {
    SEQUENTIAL,
    PARALLEL,
    RACE,
    ALL,
    DAG;

    /**
     * Whether results can be consumed incrementally through
     * {@code ExecutionEngine#executeStream}.
     */
    public boolean supportsStreaming() {
        return this == SEQUENTIAL || this == PARALLEL || this == DAG;
    }
}
