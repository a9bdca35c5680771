package com.taskweave.core.health;

import com.taskweave.core.engine.ExecutionEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the execution engine.
 * <p>
 * Reports DOWN once the engine's worker pool has been shut down, UP otherwise,
 * with run counters as details.
 */
@Component("executionEngineHealthIndicator")
public class EngineHealthIndicator implements HealthIndicator {

    private final ExecutionEngine engine;

    public EngineHealthIndicator(ExecutionEngine engine) {
        this.engine = engine;
    }

    @Override
    public Health health() {
        var stats = engine.getStats();
        var builder = engine.isShutdown() ? Health.down() : Health.up();
        return builder
                .withDetail("activeExecutions", stats.activeExecutions())
                .withDetail("totalExecutions", stats.totalExecutions())
                .withDetail("completedExecutions", stats.completedExecutions())
                .withDetail("failedExecutions", stats.failedExecutions())
                .withDetail("cancelledExecutions", stats.cancelledExecutions())
                .withDetail("timedOutExecutions", stats.timedOutExecutions())
                .build();
    }
}
