package com.taskweave.core.engine;

import com.taskweave.core.model.Task;

import java.util.ArrayList;
import java.util.concurrent.CompletableFuture;

/**
 * Every task at once with the same input; finishes when all have settled.
 */
class ParallelDriver extends StrategyDriver {

    ParallelDriver(RunScope scope) {
        super(scope);
    }

    @Override
    void drive(Object input) throws InterruptedException {
        var futures = new ArrayList<CompletableFuture<Void>>();
        for (Task task : context.plan().tasks()) {
            if (!awaitDispatch(task)) {
                break;
            }
            futures.add(dispatch(task, input).thenAccept(this::settle));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    }
}
