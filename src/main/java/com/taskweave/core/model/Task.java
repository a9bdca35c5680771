package com.taskweave.core.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named, retryable, time-bounded unit of work within an {@link ExecutionPlan}.
 *
 * @param id           unique identifier within the plan
 * @param name         display name, defaults to the id
 * @param body         the work itself
 * @param retry        retry policy; {@link RetryPolicy#none()} when not set
 * @param timeout      per-attempt timeout, nullable (engine default applies)
 * @param dependencies ids of tasks that must complete first (DAG strategy only)
 * @param condition    guard evaluated before each attempt, nullable
 * @param compensation best-effort rollback, nullable
 */
public record Task(
    String id,
    String name,
    TaskBody body,
    RetryPolicy retry,
    Duration timeout,
    List<String> dependencies,
    TaskCondition condition,
    TaskCompensation compensation
) {

    public Task {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id must not be blank");
        }
        Objects.requireNonNull(body, "Task " + id + " has no body");
        name = name != null && !name.isBlank() ? name : id;
        retry = retry != null ? retry : RetryPolicy.none();
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("Task " + id + " timeout must be positive");
        }
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }

    public boolean hasCompensation() {
        return compensation != null;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {

        private final String id;
        private String name;
        private TaskBody body;
        private RetryPolicy retry;
        private Duration timeout;
        private final List<String> dependencies = new ArrayList<>();
        private TaskCondition condition;
        private TaskCompensation compensation;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder execute(TaskBody body) {
            this.body = body;
            return this;
        }

        public Builder retry(RetryPolicy retry) {
            this.retry = retry;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder dependsOn(String... taskIds) {
            this.dependencies.addAll(List.of(taskIds));
            return this;
        }

        public Builder condition(TaskCondition condition) {
            this.condition = condition;
            return this;
        }

        public Builder compensate(TaskCompensation compensation) {
            this.compensation = compensation;
            return this;
        }

        public Task build() {
            return new Task(id, name, body, retry, timeout, dependencies, condition, compensation);
        }
    }
}
