package com.taskweave.core.engine;

import com.taskweave.core.model.Task;
import com.taskweave.core.model.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Every task at once; if any task did not complete, each completed task that
 * declares a compensation is rolled back once with its own output.
 */
final class AllDriver extends ParallelDriver {

    private static final Logger log = LoggerFactory.getLogger(AllDriver.class);

    AllDriver(RunScope scope) {
        super(scope);
    }

    @Override
    void drive(Object input) throws InterruptedException {
        super.drive(input);

        var results = context.getAllResults();
        boolean allCompleted = results.values().stream().allMatch(TaskResult::isCompleted);
        if (allCompleted) {
            return;
        }
        log.info("Execution {} has unsuccessful tasks, compensating completed ones", context.executionId());
        for (Task task : context.plan().tasks()) {
            var result = results.get(task.id());
            if (result != null && result.isCompleted() && task.hasCompensation()) {
                runner.compensate(task, input, result.output(), context, result.attempts());
            }
        }
    }
}
