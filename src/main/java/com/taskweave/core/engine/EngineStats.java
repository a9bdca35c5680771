package com.taskweave.core.engine;

/**
 * Counters over the lifetime of an {@link ExecutionEngine}.
 */
public record EngineStats(
    long totalExecutions,
    int activeExecutions,
    long completedExecutions,
    long failedExecutions,
    long cancelledExecutions,
    long timedOutExecutions
) {

    /** Share of finished runs that completed, 0 when none finished. */
    public double successRate() {
        long finished = completedExecutions + failedExecutions + cancelledExecutions + timedOutExecutions;
        return finished == 0 ? 0.0 : (double) completedExecutions / finished;
    }
}
