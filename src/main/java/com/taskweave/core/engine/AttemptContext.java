package com.taskweave.core.engine;

import com.taskweave.core.events.EngineEvent;
import com.taskweave.core.events.EventBus;
import com.taskweave.core.metrics.EngineMetrics;
import com.taskweave.core.model.CancellationToken;
import com.taskweave.core.model.TaskContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.helpers.MessageFormatter;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link TaskContext} for a single attempt of a single task.
 */
final class AttemptContext implements TaskContext {

    private static final Logger log = LoggerFactory.getLogger(TaskContext.class);

    private final ExecutionContext execution;
    private final String taskId;
    private final int attempt;
    private final Instant startTime;
    private final EventBus eventBus;
    private final EngineMetrics metrics;

    AttemptContext(ExecutionContext execution, String taskId, int attempt, Instant startTime,
                   EventBus eventBus, EngineMetrics metrics) {
        this.execution = execution;
        this.taskId = taskId;
        this.attempt = attempt;
        this.startTime = startTime;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    static String namespacedKey(String taskId, String key) {
        return "task:" + taskId + ":" + key;
    }

    @Override
    public String taskId() {
        return taskId;
    }

    @Override
    public String executionId() {
        return execution.executionId();
    }

    @Override
    public int attempt() {
        return attempt;
    }

    @Override
    public Instant startTime() {
        return startTime;
    }

    @Override
    public <T> Optional<T> getState(String key) {
        return execution.getGlobalState(namespacedKey(taskId, key));
    }

    @Override
    public void setState(String key, Object value) {
        execution.setGlobalState(namespacedKey(taskId, key), value);
    }

    @Override
    public CancellationToken cancellationToken() {
        return execution.cancellationToken();
    }

    @Override
    public void log(Level level, String message, Object... args) {
        log.atLevel(level).log(message, args);
        var payload = new HashMap<String, Object>();
        payload.put("level", level.name());
        payload.put("message", MessageFormatter.arrayFormat(message, args).getMessage());
        payload.put("attempt", attempt);
        eventBus.publish(EngineEvent.of("task.log", execution.executionId(), taskId, payload));
    }

    @Override
    public void recordMetric(String name, double value, Map<String, String> tags) {
        if (metrics != null) {
            metrics.recordTaskMetric(name, value, tags);
        }
        var payload = new HashMap<String, Object>();
        payload.put("name", name);
        payload.put("value", value);
        payload.put("tags", tags != null ? Map.copyOf(tags) : Map.of());
        eventBus.publish(EngineEvent.of("task.metric", execution.executionId(), taskId, payload));
    }
}
