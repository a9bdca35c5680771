package com.taskweave.core.engine;

import com.taskweave.core.events.EngineEvent;
import com.taskweave.core.model.Task;
import com.taskweave.core.model.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Every task at once; the first to settle, successfully or not, is the only
 * result recorded. The driver then cancels its own run so the others are
 * abandoned, which makes every race run finish CANCELLED.
 * <p>
 * Race tasks do not queue for the run's worker permits: a fast task must never
 * wait behind slow ones.
 */
final class RaceDriver extends StrategyDriver {

    private static final Logger log = LoggerFactory.getLogger(RaceDriver.class);

    RaceDriver(RunScope scope) {
        super(scope, false);
    }

    @Override
    void drive(Object input) throws InterruptedException {
        var claimed = new AtomicBoolean();
        var winner = new CompletableFuture<TaskResult>();
        int dispatched = 0;

        for (Task task : context.plan().tasks()) {
            if (claimed.get() || !awaitDispatch(task)) {
                break;
            }
            dispatch(task, input).thenAccept(result -> {
                if (claimed.compareAndSet(false, true)) {
                    settle(result);
                    log.info("Task {} won the race with status {}", result.taskId(), result.status());
                    if (context.requestCancel()) {
                        scope.eventBus().publish(EngineEvent.of("execution.cancelled", context.executionId(), null,
                                Map.of("planId", context.plan().id(), "reason", "race settled by " + result.taskId())));
                    }
                    winner.complete(result);
                }
            });
            dispatched++;
        }
        if (dispatched > 0) {
            winner.join();
        }
    }
}
