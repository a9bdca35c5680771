package com.taskweave.core.engine;

import com.taskweave.core.model.Task;
import com.taskweave.core.model.TaskResult;
import com.taskweave.core.model.TaskStatus;
import com.taskweave.core.scheduler.DagScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Dispatches tasks as their dependencies settle.
 * <p>
 * Each settlement is pushed onto a queue; the driver sleeps on that queue and
 * recomputes the ready set only when something settled. A dependency counts as
 * satisfied once it reached any terminal status, so a task still runs after a
 * dependency failed and sees a null output in its place.
 * <p>
 * Input: no dependencies, the plan input; one dependency, its output; several,
 * a list of their outputs in declared order.
 */
final class DagDriver extends StrategyDriver {

    private static final Logger log = LoggerFactory.getLogger(DagDriver.class);

    DagDriver(RunScope scope) {
        super(scope);
    }

    @Override
    void drive(Object input) throws InterruptedException {
        DagScheduler scheduler = scope.dagScheduler();
        List<Task> tasks = context.plan().tasks();
        var settled = new HashMap<String, TaskStatus>();
        var inFlight = new HashSet<String>();
        BlockingQueue<TaskResult> completions = new LinkedBlockingQueue<>();
        var settleFailure = new AtomicReference<Throwable>();

        while (true) {
            if (!context.isCancelled()) {
                for (Task task : scheduler.readyTasks(tasks, settled, inFlight)) {
                    if (!awaitDispatch(task)) {
                        break;
                    }
                    inFlight.add(task.id());
                    dispatch(task, inputFor(task, input)).thenAccept(result -> {
                        try {
                            settle(result);
                        } catch (RuntimeException e) {
                            settleFailure.compareAndSet(null, e);
                        } finally {
                            completions.add(result);
                        }
                    });
                }
            }
            if (inFlight.isEmpty()) {
                break;
            }
            markSettled(completions.take(), settled, inFlight);
            TaskResult next;
            while ((next = completions.poll()) != null) {
                markSettled(next, settled, inFlight);
            }
        }

        if (settleFailure.get() != null) {
            throw new IllegalStateException("Recording a task result of execution " + context.executionId()
                    + " failed", settleFailure.get());
        }
        if (settled.size() < tasks.size()) {
            log.info("Execution {} finished DAG with {} of {} tasks settled", context.executionId(),
                    settled.size(), tasks.size());
        }
    }

    private void markSettled(TaskResult result, HashMap<String, TaskStatus> settled, HashSet<String> inFlight) {
        inFlight.remove(result.taskId());
        settled.put(result.taskId(), result.status());
    }

    private Object inputFor(Task task, Object planInput) {
        var deps = task.dependencies();
        if (deps.isEmpty()) {
            return planInput;
        }
        if (deps.size() == 1) {
            return outputOf(deps.get(0));
        }
        var outputs = new ArrayList<Object>(deps.size());
        for (String dep : deps) {
            outputs.add(outputOf(dep));
        }
        return Collections.unmodifiableList(outputs);
    }

    private Object outputOf(String taskId) {
        return context.getTaskResult(taskId).map(TaskResult::output).orElse(null);
    }
}
