package com.taskweave.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle event emitted by the execution engine.
 *
 * @param eventType   dotted type, family first (e.g. "execution.started", "task.retrying", "compensation.failed")
 * @param executionId the run this event belongs to
 * @param taskId      the task this event relates to (nullable for run-level events)
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record EngineEvent(
    String eventType,
    String executionId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String EXECUTION_COMPLETED = "execution.completed";
    public static final String EXECUTION_FAILED = "execution.failed";

    public static EngineEvent of(String eventType, String executionId, String taskId, Map<String, Object> payload) {
        return new EngineEvent(eventType, executionId, taskId, payload, Instant.now());
    }

    /** Part of the type before the first dot: "task" for "task.retrying". */
    public String family() {
        int dot = eventType.indexOf('.');
        return dot < 0 ? eventType : eventType.substring(0, dot);
    }

    /** Last event a run publishes. */
    public boolean isTerminal() {
        return EXECUTION_COMPLETED.equals(eventType) || EXECUTION_FAILED.equals(eventType);
    }
}
