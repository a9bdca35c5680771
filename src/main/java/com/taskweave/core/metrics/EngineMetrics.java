package com.taskweave.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;

/**
 * Centralised Micrometer metrics for Taskweave runs.
 */
@Service
public class EngineMetrics {

    private final MeterRegistry registry;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordExecutionResult(String strategy, String status) {
        Counter.builder("taskweave.executions.total")
                .tag("strategy", strategy)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordExecutionDuration(String strategy, Duration duration) {
        Timer.builder("taskweave.execution.duration")
                .tag("strategy", strategy)
                .register(registry)
                .record(duration);
    }

    public void recordTaskExecution(String status, Duration duration) {
        Timer.builder("taskweave.task.duration")
                .tag("status", status)
                .register(registry)
                .record(duration);
    }

    public void incrementRetries() {
        Counter.builder("taskweave.task.retries")
                .description("Task attempts scheduled after a retryable failure")
                .register(registry)
                .increment();
    }

    /**
     * Records a compensation run.
     *
     * @param outcome "succeeded" or "failed"
     */
    public void recordCompensation(String outcome) {
        Counter.builder("taskweave.compensations.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records a free-form measurement emitted by a task body.
     */
    public void recordTaskMetric(String name, double value, Map<String, String> tags) {
        var builder = DistributionSummary.builder("taskweave.task.metric")
                .tag("metric", name);
        if (tags != null) {
            tags.forEach(builder::tag);
        }
        builder.register(registry).record(value);
    }
}
