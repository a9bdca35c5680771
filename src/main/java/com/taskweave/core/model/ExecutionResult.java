package com.taskweave.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a whole run.
 *
 * @param executionId run identifier
 * @param planId      the plan that was executed
 * @param status      final status (CANCELLED &gt; TIMEOUT &gt; FAILED &gt; COMPLETED)
 * @param results     task id to result, in completion order
 * @param duration    wall-clock run time
 * @param startedAt   run start
 * @param completedAt run end
 * @param error       plan error or unexpected driver failure, null otherwise
 */
public record ExecutionResult(
    String executionId,
    String planId,
    ExecutionStatus status,
    Map<String, TaskResult> results,
    Duration duration,
    Instant startedAt,
    Instant completedAt,
    Throwable error
) {

    public ExecutionResult {
        results = results != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(results))
                : Map.of();
    }

    public Optional<TaskResult> result(String taskId) {
        return Optional.ofNullable(results.get(taskId));
    }

    public boolean isSuccessful() {
        return status == ExecutionStatus.COMPLETED;
    }
}
