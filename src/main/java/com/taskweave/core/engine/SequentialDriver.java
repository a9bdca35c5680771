package com.taskweave.core.engine;

import com.taskweave.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One task at a time in plan order. Each output becomes the next task's input.
 * A failed task without compensation stops the remaining tasks.
 */
final class SequentialDriver extends StrategyDriver {

    private static final Logger log = LoggerFactory.getLogger(SequentialDriver.class);

    SequentialDriver(RunScope scope) {
        super(scope);
    }

    @Override
    void drive(Object input) throws InterruptedException {
        Object current = input;
        for (Task task : context.plan().tasks()) {
            if (!awaitDispatch(task)) {
                break;
            }
            var result = dispatch(task, current).join();
            settle(result);

            if (result.status().isFailure() && !task.hasCompensation()) {
                log.info("Task {} ended {} without compensation, stopping sequence", task.id(), result.status());
                break;
            }
            if (result.output() != null) {
                current = result.output();
            }
        }
    }
}
