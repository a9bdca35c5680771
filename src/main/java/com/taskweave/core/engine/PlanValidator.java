package com.taskweave.core.engine;

import com.taskweave.core.model.ExecutionPlan;
import com.taskweave.core.model.ExecutionStrategy;
import com.taskweave.core.model.Task;
import com.taskweave.core.scheduler.DagScheduler;

import java.util.HashSet;
import java.util.LinkedHashSet;

/**
 * Structural checks run before any task of a plan is dispatched.
 */
final class PlanValidator {

    private final DagScheduler dagScheduler;

    PlanValidator(DagScheduler dagScheduler) {
        this.dagScheduler = dagScheduler;
    }

    void validate(ExecutionPlan plan) {
        if (plan.strategy() == null) {
            throw new PlanValidationException(plan.id(), "Plan " + plan.id() + " has no execution strategy");
        }

        var seen = new HashSet<String>();
        var duplicates = new LinkedHashSet<String>();
        for (Task task : plan.tasks()) {
            if (!seen.add(task.id())) {
                duplicates.add(task.id());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new PlanValidationException(plan.id(),
                    "Plan " + plan.id() + " has duplicate task ids: " + duplicates);
        }

        var unknown = dagScheduler.unknownDependencies(plan.tasks());
        if (!unknown.isEmpty()) {
            throw new PlanValidationException(plan.id(),
                    "Plan " + plan.id() + " references unknown dependencies: " + unknown);
        }

        if (plan.strategy() == ExecutionStrategy.DAG) {
            dagScheduler.findCycle(plan.tasks()).ifPresent(cycle -> {
                throw new PlanValidationException(plan.id(),
                        "Plan " + plan.id() + " has a dependency cycle: " + String.join(" -> ", cycle));
            });
        }
    }
}
