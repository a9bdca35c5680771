package com.taskweave.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EngineMetricsTest {

    private SimpleMeterRegistry registry;
    private EngineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new EngineMetrics(registry);
    }

    @Test
    @DisplayName("recordExecutionResult increments by strategy and status")
    void recordExecutionResult() {
        metrics.recordExecutionResult("DAG", "COMPLETED");
        metrics.recordExecutionResult("DAG", "COMPLETED");
        metrics.recordExecutionResult("DAG", "FAILED");

        var completed = registry.find("taskweave.executions.total")
                .tag("strategy", "DAG").tag("status", "COMPLETED").counter();
        var failed = registry.find("taskweave.executions.total")
                .tag("status", "FAILED").counter();

        assertNotNull(completed);
        assertNotNull(failed);
        assertEquals(2.0, completed.count());
        assertEquals(1.0, failed.count());
    }

    @Test
    @DisplayName("recordTaskExecution records a timer per status")
    void recordTaskExecution() {
        metrics.recordTaskExecution("COMPLETED", Duration.ofMillis(200));
        metrics.recordTaskExecution("TIMEOUT", Duration.ofMillis(1000));

        var completed = registry.find("taskweave.task.duration").tag("status", "COMPLETED").timer();
        var timedOut = registry.find("taskweave.task.duration").tag("status", "TIMEOUT").timer();

        assertNotNull(completed);
        assertNotNull(timedOut);
        assertEquals(1, completed.count());
        assertEquals(1, timedOut.count());
    }

    @Test
    @DisplayName("incrementRetries counts retries")
    void incrementRetries() {
        metrics.incrementRetries();
        metrics.incrementRetries();

        assertEquals(2.0, registry.find("taskweave.task.retries").counter().count());
    }

    @Test
    @DisplayName("recordCompensation tags the outcome")
    void recordCompensation() {
        metrics.recordCompensation("failed");

        var failed = registry.find("taskweave.compensations.total").tag("outcome", "failed").counter();
        assertNotNull(failed);
        assertEquals(1.0, failed.count());
    }

    @Test
    @DisplayName("recordTaskMetric records a summary tagged with metric name and caller tags")
    void recordTaskMetric() {
        metrics.recordTaskMetric("rows", 42, Map.of("table", "orders"));

        var summary = registry.find("taskweave.task.metric")
                .tag("metric", "rows").tag("table", "orders").summary();
        assertNotNull(summary);
        assertEquals(42.0, summary.totalAmount());
    }
}
