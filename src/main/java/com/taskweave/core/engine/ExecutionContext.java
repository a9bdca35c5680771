package com.taskweave.core.engine;

import com.taskweave.core.model.CancellationToken;
import com.taskweave.core.model.ExecutionPlan;
import com.taskweave.core.model.ExecutionStatus;
import com.taskweave.core.model.TaskResult;
import com.taskweave.core.model.TaskStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * State of one run: global store, task results, live task statuses, the
 * cancellation switch and the pause gate.
 * <p>
 * Results are written only by the engine. Task bodies reach the global store
 * through their own {@link com.taskweave.core.model.TaskContext}, which confines
 * them to their {@code task:<id>:} namespace.
 */
public class ExecutionContext {

    private final String executionId;
    private final ExecutionPlan plan;
    private final Instant startTime;

    private final ConcurrentHashMap<String, Object> globalState = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, TaskStatus> taskStatuses = new ConcurrentHashMap<>();
    private final Map<String, TaskResult> results = new LinkedHashMap<>();

    private final CancellationSignal signal = new CancellationSignal();
    private final PauseGate pauseGate = new PauseGate(signal);
    private volatile boolean cancelRequested;
    private volatile boolean timedOut;

    public ExecutionContext(String executionId, ExecutionPlan plan, Instant startTime) {
        this.executionId = executionId;
        this.plan = plan;
        this.startTime = startTime;
        plan.tasks().forEach(t -> taskStatuses.put(t.id(), TaskStatus.PENDING));
    }

    public String executionId() {
        return executionId;
    }

    public ExecutionPlan plan() {
        return plan;
    }

    public Instant startTime() {
        return startTime;
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> getGlobalState(String key) {
        return Optional.ofNullable((T) globalState.get(key));
    }

    /**
     * Stores a run-wide value. A null value removes the key.
     */
    public void setGlobalState(String key, Object value) {
        if (value == null) {
            globalState.remove(key);
        } else {
            globalState.put(key, value);
        }
    }

    public synchronized Optional<TaskResult> getTaskResult(String taskId) {
        return Optional.ofNullable(results.get(taskId));
    }

    /**
     * Snapshot of the recorded results in completion order.
     */
    public synchronized Map<String, TaskResult> getAllResults() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public TaskStatus taskStatus(String taskId) {
        return taskStatuses.get(taskId);
    }

    public Map<String, TaskStatus> taskStatuses() {
        return Map.copyOf(taskStatuses);
    }

    public CancellationToken cancellationToken() {
        return signal;
    }

    /** True once the switch flipped for any reason (cancel request or plan timeout). */
    public boolean isCancelled() {
        return signal.isCancelled();
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public boolean isPaused() {
        return pauseGate.isPaused();
    }

    /**
     * Status the run would finish with right now:
     * CANCELLED &gt; TIMEOUT &gt; FAILED &gt; COMPLETED.
     */
    public ExecutionStatus currentStatus() {
        if (cancelRequested) {
            return ExecutionStatus.CANCELLED;
        }
        if (timedOut) {
            return ExecutionStatus.TIMEOUT;
        }
        return hasFailures() ? ExecutionStatus.FAILED : ExecutionStatus.COMPLETED;
    }

    synchronized boolean hasFailures() {
        return results.values().stream().anyMatch(r -> r.status().isFailure());
    }

    synchronized void recordResult(TaskResult result) {
        results.put(result.taskId(), result);
        taskStatuses.put(result.taskId(), result.status());
    }

    void markStatus(String taskId, TaskStatus status) {
        taskStatuses.put(taskId, status);
    }

    CancellationSignal cancellationSignal() {
        return signal;
    }

    PauseGate pauseGate() {
        return pauseGate;
    }

    /**
     * Cancellation requested by a caller.
     *
     * @return false if the run was already requested to cancel
     */
    boolean requestCancel() {
        if (cancelRequested) {
            return false;
        }
        cancelRequested = true;
        signal.trip();
        return true;
    }

    /** Plan-wide timer fired. */
    boolean markTimedOut() {
        timedOut = true;
        return signal.trip();
    }
}
