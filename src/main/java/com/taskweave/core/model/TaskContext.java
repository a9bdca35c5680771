package com.taskweave.core.model;

import org.slf4j.event.Level;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Per-attempt handle given to task bodies, conditions and compensations.
 * <p>
 * State accessors are scoped to the owning task: keys are stored in the run's
 * global store as {@code task:<taskId>:<key>}, so one task never sees another's state.
 */
public interface TaskContext {

    String taskId();

    String executionId();

    int attempt();

    Instant startTime();

    <T> Optional<T> getState(String key);

    /**
     * Stores a value under this task's namespace. A null value removes the key.
     */
    void setState(String key, Object value);

    CancellationToken cancellationToken();

    void log(Level level, String message, Object... args);

    void recordMetric(String name, double value, Map<String, String> tags);

    default void recordMetric(String name, double value) {
        recordMetric(name, value, Map.of());
    }
}
