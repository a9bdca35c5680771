package com.taskweave.core.engine;

import com.taskweave.core.events.EngineEvent;
import com.taskweave.core.events.EventBus;
import com.taskweave.core.logging.MdcContext;
import com.taskweave.core.metrics.EngineMetrics;
import com.taskweave.core.model.RetryPolicy;
import com.taskweave.core.model.Task;
import com.taskweave.core.model.TaskCancelledException;
import com.taskweave.core.model.TaskResult;
import com.taskweave.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs one task to a terminal result: condition check, time-bounded attempts,
 * retry with backoff, and compensation once attempts are exhausted.
 * <p>
 * The body runs on a worker thread and is raced against the task timer and the
 * run's cancellation signal. When the timer or the signal wins, the body is
 * abandoned, not stopped.
 */
final class TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    private final Executor workers;
    private final ScheduledExecutorService timers;
    private final EventBus eventBus;
    private final EngineMetrics metrics;
    private final Backoff backoff;
    private final Duration defaultTimeout;
    private final Clock clock;

    TaskRunner(Executor workers, ScheduledExecutorService timers, EventBus eventBus, EngineMetrics metrics,
               Backoff backoff, Duration defaultTimeout, Clock clock) {
        this.workers = workers;
        this.timers = timers;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.backoff = backoff;
        this.defaultTimeout = defaultTimeout;
        this.clock = clock;
    }

    TaskResult run(Task task, Object input, ExecutionContext context) {
        String taskId = task.id();
        RetryPolicy policy = task.retry();
        Instant startedAt = clock.instant();
        int attempts = 0;
        Exception lastError = null;

        while (attempts < policy.maxAttempts()) {
            if (context.isCancelled()) {
                return cancelled(taskId, "Task " + taskId + " cancelled before attempt " + (attempts + 1),
                        attempts, startedAt);
            }
            try {
                context.pauseGate().awaitOpen(context.cancellationSignal(),
                        () -> context.markStatus(taskId, TaskStatus.PAUSED));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return cancelled(taskId, "Interrupted while paused", attempts, startedAt);
            }
            if (context.isCancelled()) {
                return cancelled(taskId, "Task " + taskId + " cancelled while paused", attempts, startedAt);
            }

            int attempt = attempts + 1;
            MdcContext.setAttempt(context.executionId(), taskId, attempt);
            var attemptContext = new AttemptContext(context, taskId, attempt, clock.instant(), eventBus, metrics);
            try {
                if (task.condition() != null && !task.condition().shouldRun(input, attemptContext)) {
                    log.info("Task {} skipped: condition evaluated false", taskId);
                    return TaskResult.skipped(taskId, attempts, clock.instant());
                }
                attempts = attempt;
                context.markStatus(taskId, TaskStatus.RUNNING);
                publish("task.started", context, taskId, Map.of("attempt", attempt, "name", task.name()));
                log.debug("Task {} attempt {}/{} started", taskId, attempt, policy.maxAttempts());

                Object output = runAttempt(task, input, attemptContext, context.cancellationSignal());

                var result = TaskResult.completed(taskId, output, attempts, startedAt, clock.instant());
                publish("task.completed", context, taskId,
                        Map.of("attempts", attempts, "durationMs", result.duration().toMillis()));
                log.info("Task {} completed after {} attempt(s) in {}ms", taskId, attempts,
                        result.duration().toMillis());
                return result;
            } catch (TaskCancelledException e) {
                attempts = attempt;
                log.info("Task {} abandoned: {}", taskId, e.getMessage());
                return cancelled(taskId, e, attempts, startedAt);
            } catch (Exception e) {
                attempts = attempt;
                lastError = e;
                publish("task.failed", context, taskId, errorPayload(attempt, e));
                log.warn("Task {} attempt {}/{} failed: {}", taskId, attempt, policy.maxAttempts(), e.getMessage());

                if (attempts >= policy.maxAttempts() || !isRetryable(policy, e)) {
                    break;
                }
                Duration delay = backoff.delay(policy, attempts);
                if (metrics != null) {
                    metrics.incrementRetries();
                }
                publish("task.retrying", context, taskId,
                        Map.of("attempt", attempts + 1, "delayMs", delay.toMillis()));
                log.info("Retrying task {} in {}ms (attempt {}/{})", taskId, delay.toMillis(),
                        attempts + 1, policy.maxAttempts());
                try {
                    if (context.cancellationSignal().await(delay)) {
                        return cancelled(taskId, "Task " + taskId + " cancelled during backoff", attempts, startedAt);
                    }
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return cancelled(taskId, "Interrupted during backoff", attempts, startedAt);
                }
            }
        }

        TaskStatus status = lastError instanceof TaskTimeoutException ? TaskStatus.TIMEOUT : TaskStatus.FAILED;
        var result = TaskResult.unsuccessful(taskId, status, lastError, attempts, startedAt, clock.instant());
        log.warn("Task {} {} after {} attempt(s): {}", taskId, status, attempts, result.errorMessage());

        if (task.hasCompensation()) {
            compensate(task, input, null, context, attempts);
        }
        return result;
    }

    /**
     * Invokes the task's compensation. Failures are logged and published, never rethrown.
     *
     * @return true if the compensation ran without error
     */
    boolean compensate(Task task, Object input, Object output, ExecutionContext context, int attempt) {
        var compensationContext = new AttemptContext(context, task.id(), attempt, clock.instant(), eventBus, metrics);
        try {
            log.info("Compensating task {}", task.id());
            task.compensation().compensate(input, output, compensationContext);
            if (metrics != null) {
                metrics.recordCompensation("succeeded");
            }
            return true;
        } catch (Exception e) {
            log.error("Compensation for task {} failed: {}", task.id(), e.getMessage(), e);
            if (metrics != null) {
                metrics.recordCompensation("failed");
            }
            publish("compensation.failed", context, task.id(), errorPayload(attempt, e));
            return false;
        }
    }

    private Object runAttempt(Task task, Object input, AttemptContext attemptContext,
                              CancellationSignal signal) throws Exception {
        Duration timeout = task.timeout() != null ? task.timeout() : defaultTimeout;
        var outcome = new CompletableFuture<Object>();

        workers.execute(MdcContext.propagate(() -> {
            try {
                outcome.complete(task.body().execute(input, attemptContext));
            } catch (Throwable t) {
                outcome.completeExceptionally(t);
            }
        }));
        ScheduledFuture<?> timer = timers.schedule(
                () -> outcome.completeExceptionally(new TaskTimeoutException(task.id(), timeout)),
                timeout.toMillis(), TimeUnit.MILLISECONDS);
        var registration = signal.onCancel(() -> outcome.completeExceptionally(
                new TaskCancelledException("Task " + task.id() + " cancelled")));

        try {
            return outcome.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw new IllegalStateException("Task " + task.id() + " raised " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskCancelledException("Interrupted while waiting for task " + task.id());
        } finally {
            timer.cancel(false);
            registration.remove();
        }
    }

    /**
     * Cancellation is never retried; a timeout only when the policy lists a matching
     * substring; any other error when the policy lists nothing or a substring matches.
     */
    static boolean isRetryable(RetryPolicy policy, Exception error) {
        if (error instanceof TaskCancelledException) {
            return false;
        }
        if (error instanceof TaskTimeoutException) {
            return policy.explicitlyLists(error.getMessage());
        }
        return policy.matches(error.getMessage());
    }

    private TaskResult cancelled(String taskId, String reason, int attempts, Instant startedAt) {
        return cancelled(taskId, new TaskCancelledException(reason), attempts, startedAt);
    }

    private TaskResult cancelled(String taskId, TaskCancelledException error, int attempts, Instant startedAt) {
        return TaskResult.unsuccessful(taskId, TaskStatus.CANCELLED, error, attempts, startedAt, clock.instant());
    }

    private void publish(String type, ExecutionContext context, String taskId, Map<String, Object> payload) {
        eventBus.publish(EngineEvent.of(type, context.executionId(), taskId, payload));
    }

    private static Map<String, Object> errorPayload(int attempt, Exception error) {
        var payload = new HashMap<String, Object>();
        payload.put("attempt", attempt);
        payload.put("errorType", error.getClass().getSimpleName());
        payload.put("error", String.valueOf(error.getMessage()));
        return payload;
    }
}
