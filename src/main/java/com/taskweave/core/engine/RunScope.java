package com.taskweave.core.engine;

import com.taskweave.core.events.EventBus;
import com.taskweave.core.metrics.EngineMetrics;
import com.taskweave.core.model.TaskResult;
import com.taskweave.core.scheduler.DagScheduler;

import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Collaborators a strategy driver needs for one run.
 *
 * @param context      the run being driven
 * @param runner       per-task execution
 * @param executor     threads that run tasks
 * @param maxParallel  tasks of this run allowed to run at once
 * @param sink         receives every settled result, in completion order
 * @param eventBus     lifecycle events
 * @param metrics      nullable
 * @param dagScheduler ready-set computation for DAG plans
 */
record RunScope(
    ExecutionContext context,
    TaskRunner runner,
    Executor executor,
    int maxParallel,
    Consumer<TaskResult> sink,
    EventBus eventBus,
    EngineMetrics metrics,
    DagScheduler dagScheduler
) {}
