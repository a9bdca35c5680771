package com.taskweave.core.engine;

import com.taskweave.core.config.EngineProperties;
import com.taskweave.core.events.EngineEvent;
import com.taskweave.core.events.EventBus;
import com.taskweave.core.logging.MdcContext;
import com.taskweave.core.metrics.EngineMetrics;
import com.taskweave.core.model.ExecutionPlan;
import com.taskweave.core.model.ExecutionResult;
import com.taskweave.core.model.ExecutionStatus;
import com.taskweave.core.model.TaskResult;
import com.taskweave.core.scheduler.DagScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Executes plans: validates them, dispatches their tasks per strategy, enforces
 * per-task and plan-wide timeouts, retries, compensates, and aggregates results.
 * <p>
 * Runs are tracked by execution id only while in flight, so {@link #cancel},
 * {@link #pause} and {@link #resume} act on live runs. Per-task failures never
 * escape {@link #execute}: they are reported through the result's status and
 * task results.
 */
@Service
public class ExecutionEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final EngineProperties properties;
    private final EventBus eventBus;
    private final EngineMetrics metrics;
    private final DagScheduler dagScheduler;
    private final PlanValidator planValidator;
    private final ExecutorService workers;
    private final ScheduledThreadPoolExecutor timers;
    private final TaskRunner runner;

    private final ConcurrentHashMap<String, ExecutionContext> executions = new ConcurrentHashMap<>();
    private final AtomicLong totalExecutions = new AtomicLong();
    private final ConcurrentHashMap<ExecutionStatus, AtomicLong> finishedByStatus = new ConcurrentHashMap<>();

    @Autowired
    public ExecutionEngine(EngineProperties properties, EventBus eventBus, EngineMetrics metrics,
                           DagScheduler dagScheduler) {
        this(properties, eventBus, metrics, dagScheduler, new Backoff());
    }

    public ExecutionEngine(EngineProperties properties) {
        this(properties, new EventBus(), null, new DagScheduler(), new Backoff());
    }

    ExecutionEngine(EngineProperties properties, EventBus eventBus, EngineMetrics metrics,
                    DagScheduler dagScheduler, Backoff backoff) {
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.dagScheduler = dagScheduler;
        this.planValidator = new PlanValidator(dagScheduler);
        this.workers = Executors.newCachedThreadPool(threadFactory(properties.getThreadNamePrefix() + "worker-"));
        this.timers = new ScheduledThreadPoolExecutor(1, threadFactory(properties.getThreadNamePrefix() + "timer-"));
        this.timers.setRemoveOnCancelPolicy(true);
        this.runner = new TaskRunner(workers, timers, eventBus, metrics, backoff,
                properties.getDefaultTaskTimeout(), Clock.systemUTC());
    }

    public ExecutionResult execute(ExecutionPlan plan) {
        return execute(plan, null);
    }

    /**
     * Runs a plan to completion on the calling thread.
     *
     * @param plan  the plan to run
     * @param input input of the first task (sequential) or of every root task
     * @return the run result; a structurally invalid plan yields a FAILED result
     *         with {@link ExecutionResult#error()} set and no task results
     */
    public ExecutionResult execute(ExecutionPlan plan, Object input) {
        Objects.requireNonNull(plan, "plan");
        String executionId = UUID.randomUUID().toString();
        Instant startedAt = Instant.now();
        try {
            planValidator.validate(plan);
        } catch (PlanValidationException e) {
            return rejected(executionId, plan, startedAt, e);
        }
        var context = new ExecutionContext(executionId, plan, startedAt);
        executions.put(executionId, context);
        return run(context, input, result -> {});
    }

    public TaskResultStream executeStream(ExecutionPlan plan) {
        return executeStream(plan, null);
    }

    /**
     * Starts a plan on an engine thread and returns its task results as they settle.
     *
     * @throws IllegalArgumentException  for RACE and ALL plans, which cannot stream
     * @throws PlanValidationException   if the plan is structurally invalid
     */
    public TaskResultStream executeStream(ExecutionPlan plan, Object input) {
        Objects.requireNonNull(plan, "plan");
        if (plan.strategy() != null && !plan.strategy().supportsStreaming()) {
            throw new IllegalArgumentException("Stream not supported for strategy: " + plan.strategy());
        }
        planValidator.validate(plan);

        String executionId = UUID.randomUUID().toString();
        var context = new ExecutionContext(executionId, plan, Instant.now());
        var stream = new TaskResultStream(executionId, () -> cancel(executionId));
        executions.put(executionId, context);

        workers.execute(() -> {
            try {
                stream.finish(run(context, input, stream::push));
            } catch (RuntimeException e) {
                log.error("Streaming execution {} failed", executionId, e);
                stream.fail(e);
            }
        });
        return stream;
    }

    /**
     * Requests cooperative cancellation of a live run. In-flight task bodies keep
     * running until they observe the signal; no new task is dispatched.
     *
     * @return false if no such run is in flight
     */
    public boolean cancel(String executionId) {
        var context = executions.get(executionId);
        if (context == null || !context.requestCancel()) {
            return false;
        }
        log.info("Execution {} cancellation requested", executionId);
        publish("execution.cancelled", executionId, null, Map.of("planId", context.plan().id()));
        return true;
    }

    /**
     * Holds every further dispatch of a live run until {@link #resume}. Tasks already
     * running are not interrupted.
     */
    public boolean pause(String executionId) {
        var context = executions.get(executionId);
        if (context == null || !context.pauseGate().pause()) {
            return false;
        }
        log.info("Execution {} paused", executionId);
        publish("execution.paused", executionId, null, Map.of("planId", context.plan().id()));
        return true;
    }

    public boolean resume(String executionId) {
        var context = executions.get(executionId);
        if (context == null || !context.pauseGate().resume()) {
            return false;
        }
        log.info("Execution {} resumed", executionId);
        publish("execution.resumed", executionId, null, Map.of("planId", context.plan().id()));
        return true;
    }

    public Optional<ExecutionContext> findExecution(String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    public Set<String> activeExecutionIds() {
        return Set.copyOf(executions.keySet());
    }

    public EngineStats getStats() {
        return new EngineStats(
                totalExecutions.get(),
                executions.size(),
                finished(ExecutionStatus.COMPLETED),
                finished(ExecutionStatus.FAILED),
                finished(ExecutionStatus.CANCELLED),
                finished(ExecutionStatus.TIMEOUT));
    }

    public boolean isShutdown() {
        return workers.isShutdown();
    }

    /**
     * Cancels live runs and stops the engine's threads.
     */
    @Override
    public void close() {
        if (workers.isShutdown()) {
            return;
        }
        executions.keySet().forEach(this::cancel);
        workers.shutdown();
        timers.shutdownNow();
        try {
            if (!workers.awaitTermination(properties.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers still busy after {}, forcing shutdown", properties.getShutdownTimeout());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private ExecutionResult run(ExecutionContext context, Object input, Consumer<TaskResult> sink) {
        String executionId = context.executionId();
        ExecutionPlan plan = context.plan();
        totalExecutions.incrementAndGet();
        MdcContext.setExecution(executionId);
        ScheduledFuture<?> timer = armGlobalTimeout(context);
        Throwable failure = null;
        try {
            log.info("Starting execution {} of plan {} ({} tasks, strategy={})",
                    executionId, plan.id(), plan.tasks().size(), plan.strategy());
            publish("execution.started", executionId, null, Map.of(
                    "planId", plan.id(),
                    "strategy", plan.strategy().name(),
                    "taskCount", plan.tasks().size()));

            var scope = new RunScope(context, runner, workers, properties.getMaxParallel(), sink,
                    eventBus, metrics, dagScheduler);
            StrategyDriver.create(plan.strategy(), scope).drive(input);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Execution {} interrupted", executionId);
            context.requestCancel();
        } catch (RuntimeException e) {
            log.error("Execution {} aborted by unexpected error", executionId, e);
            failure = e;
        } finally {
            if (timer != null) {
                timer.cancel(false);
            }
            executions.remove(executionId);
        }

        try {
            ExecutionStatus status = context.currentStatus();
            if (failure != null && status == ExecutionStatus.COMPLETED) {
                status = ExecutionStatus.FAILED;
            }
            Instant completedAt = Instant.now();
            var result = new ExecutionResult(executionId, plan.id(), status, context.getAllResults(),
                    Duration.between(context.startTime(), completedAt), context.startTime(), completedAt, failure);

            log.info("Execution {} finished {} in {}ms ({} task results)", executionId, status,
                    result.duration().toMillis(), result.results().size());
            if (failure != null) {
                publish(EngineEvent.EXECUTION_FAILED, executionId, null, failurePayload(plan, failure));
            } else {
                publish(EngineEvent.EXECUTION_COMPLETED, executionId, null, Map.of(
                        "planId", plan.id(),
                        "status", status.name(),
                        "durationMs", result.duration().toMillis()));
            }
            recordFinished(plan, result);
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    private ExecutionResult rejected(String executionId, ExecutionPlan plan, Instant startedAt,
                                     PlanValidationException error) {
        log.error("Plan {} rejected: {}", plan.id(), error.getMessage());
        totalExecutions.incrementAndGet();
        Instant completedAt = Instant.now();
        var result = new ExecutionResult(executionId, plan.id(), ExecutionStatus.FAILED, Map.of(),
                Duration.between(startedAt, completedAt), startedAt, completedAt, error);
        publish(EngineEvent.EXECUTION_FAILED, executionId, null, failurePayload(plan, error));
        recordFinished(plan, result);
        return result;
    }

    private ScheduledFuture<?> armGlobalTimeout(ExecutionContext context) {
        Duration timeout = context.plan().globalTimeout();
        if (timeout == null) {
            return null;
        }
        return timers.schedule(() -> {
            if (context.markTimedOut()) {
                log.warn("Execution {} exceeded its global timeout of {}ms", context.executionId(), timeout.toMillis());
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void recordFinished(ExecutionPlan plan, ExecutionResult result) {
        finishedByStatus.computeIfAbsent(result.status(), s -> new AtomicLong()).incrementAndGet();
        if (metrics != null) {
            String strategy = plan.strategy() != null ? plan.strategy().name() : "NONE";
            metrics.recordExecutionResult(strategy, result.status().name());
            metrics.recordExecutionDuration(strategy, result.duration());
        }
    }

    private long finished(ExecutionStatus status) {
        var counter = finishedByStatus.get(status);
        return counter != null ? counter.get() : 0;
    }

    private void publish(String type, String executionId, String taskId, Map<String, Object> payload) {
        eventBus.publish(EngineEvent.of(type, executionId, taskId, payload));
    }

    private static Map<String, Object> failurePayload(ExecutionPlan plan, Throwable error) {
        var payload = new HashMap<String, Object>();
        payload.put("planId", plan.id());
        payload.put("errorType", error.getClass().getSimpleName());
        payload.put("error", String.valueOf(error.getMessage()));
        return payload;
    }

    private static ThreadFactory threadFactory(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
