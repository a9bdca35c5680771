package com.taskweave.core.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * An ordered set of tasks plus the strategy that schedules them. Immutable once built.
 *
 * @param id             plan identifier
 * @param name           display name, defaults to the id
 * @param strategy       scheduling discipline
 * @param tasks          tasks in plan order
 * @param globalTimeout  wall-clock bound for the whole run, nullable
 * @param onTaskComplete invoked once for every settled task, nullable
 * @param onTaskError    invoked once for every task that settled FAILED or TIMEOUT, nullable
 */
public record ExecutionPlan(
    String id,
    String name,
    ExecutionStrategy strategy,
    List<Task> tasks,
    Duration globalTimeout,
    Consumer<TaskResult> onTaskComplete,
    Consumer<TaskResult> onTaskError
) {

    public ExecutionPlan {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Plan id must not be blank");
        }
        name = name != null && !name.isBlank() ? name : id;
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
        if (globalTimeout != null && (globalTimeout.isNegative() || globalTimeout.isZero())) {
            throw new IllegalArgumentException("Plan " + id + " globalTimeout must be positive");
        }
    }

    public Optional<Task> task(String taskId) {
        return tasks.stream().filter(t -> t.id().equals(taskId)).findFirst();
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {

        private final String id;
        private String name;
        private ExecutionStrategy strategy = ExecutionStrategy.SEQUENTIAL;
        private final List<Task> tasks = new ArrayList<>();
        private Duration globalTimeout;
        private Consumer<TaskResult> onTaskComplete;
        private Consumer<TaskResult> onTaskError;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder strategy(ExecutionStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder task(Task task) {
            this.tasks.add(Objects.requireNonNull(task, "task"));
            return this;
        }

        public Builder tasks(List<Task> tasks) {
            tasks.forEach(this::task);
            return this;
        }

        public Builder globalTimeout(Duration globalTimeout) {
            this.globalTimeout = globalTimeout;
            return this;
        }

        public Builder onTaskComplete(Consumer<TaskResult> callback) {
            this.onTaskComplete = callback;
            return this;
        }

        public Builder onTaskError(Consumer<TaskResult> callback) {
            this.onTaskError = callback;
            return this;
        }

        public ExecutionPlan build() {
            return new ExecutionPlan(id, name, strategy, tasks, globalTimeout, onTaskComplete, onTaskError);
        }
    }
}
