package com.taskweave.core.engine;

import com.taskweave.core.logging.MdcContext;
import com.taskweave.core.model.ExecutionStrategy;
import com.taskweave.core.model.Task;
import com.taskweave.core.model.TaskCancelledException;
import com.taskweave.core.model.TaskResult;
import com.taskweave.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.function.Consumer;

/**
 * Dispatches the tasks of one run according to a strategy.
 * <p>
 * Every dispatch goes through {@link #awaitDispatch(Task)}, which holds while the
 * run is paused and refuses once it is cancelled. Every recorded result goes
 * through {@link #settle(TaskResult)}, which serializes recording, streaming and
 * plan callbacks so they observe completion order.
 */
abstract class StrategyDriver {

    private static final Logger log = LoggerFactory.getLogger(StrategyDriver.class);

    protected final ExecutionContext context;
    protected final TaskRunner runner;
    protected final RunScope scope;
    private final Semaphore permits;
    private final Object settleLock = new Object();

    StrategyDriver(RunScope scope) {
        this(scope, true);
    }

    /**
     * @param bounded whether running tasks share the run's {@code max-parallel} permits
     */
    StrategyDriver(RunScope scope, boolean bounded) {
        this.scope = scope;
        this.context = scope.context();
        this.runner = scope.runner();
        this.permits = bounded ? new Semaphore(Math.max(1, scope.maxParallel())) : null;
    }

    static StrategyDriver create(ExecutionStrategy strategy, RunScope scope) {
        return switch (strategy) {
            case SEQUENTIAL -> new SequentialDriver(scope);
            case PARALLEL -> new ParallelDriver(scope);
            case RACE -> new RaceDriver(scope);
            case ALL -> new AllDriver(scope);
            case DAG -> new DagDriver(scope);
        };
    }

    /**
     * Runs the plan's tasks until the strategy's completion rule is met.
     */
    abstract void drive(Object input) throws InterruptedException;

    /**
     * Blocks while the run is paused.
     *
     * @return false once the run is cancelled; nothing new may be dispatched then
     */
    protected boolean awaitDispatch(Task task) throws InterruptedException {
        context.pauseGate().awaitOpen(context.cancellationSignal(),
                () -> context.markStatus(task.id(), TaskStatus.PAUSED));
        if (context.isCancelled()) {
            log.info("Execution {} cancelled, not dispatching task {}", context.executionId(), task.id());
            return false;
        }
        return true;
    }

    /**
     * Starts a task on a worker thread. The returned future never completes exceptionally.
     */
    protected CompletableFuture<TaskResult> dispatch(Task task, Object input) {
        context.markStatus(task.id(), TaskStatus.SCHEDULED);
        var future = new CompletableFuture<TaskResult>();
        scope.executor().execute(MdcContext.propagate(() -> future.complete(runWithPermit(task, input))));
        return future;
    }

    /**
     * Records a terminal result and notifies the stream sink and plan callbacks.
     */
    protected void settle(TaskResult result) {
        synchronized (settleLock) {
            context.recordResult(result);
            if (scope.metrics() != null) {
                scope.metrics().recordTaskExecution(result.status().name(), result.duration());
            }
            scope.sink().accept(result);
            var plan = context.plan();
            invokeCallback(plan.onTaskComplete(), result, "onTaskComplete");
            if (result.status().isFailure()) {
                invokeCallback(plan.onTaskError(), result, "onTaskError");
            }
        }
    }

    private TaskResult runWithPermit(Task task, Object input) {
        MdcContext.setTask(context.executionId(), task.id());
        try {
            if (permits != null) {
                permits.acquire();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            Instant now = Instant.now();
            return TaskResult.unsuccessful(task.id(), TaskStatus.CANCELLED,
                    new TaskCancelledException("Interrupted waiting for a worker"), 0, now, now);
        }
        try {
            return runner.run(task, input, context);
        } catch (RuntimeException e) {
            log.error("Unexpected error running task {}", task.id(), e);
            Instant now = Instant.now();
            return TaskResult.unsuccessful(task.id(), TaskStatus.FAILED, e, 0, now, now);
        } finally {
            if (permits != null) {
                permits.release();
            }
            MdcContext.clear();
        }
    }

    private void invokeCallback(Consumer<TaskResult> callback, TaskResult result, String name) {
        if (callback == null) {
            return;
        }
        try {
            callback.accept(result);
        } catch (RuntimeException e) {
            log.warn("{} callback threw for task {}: {}", name, result.taskId(), e.getMessage(), e);
        }
    }
}
