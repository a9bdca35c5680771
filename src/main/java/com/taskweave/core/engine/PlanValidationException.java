package com.taskweave.core.engine;

/**
 * Structural problem with a plan (duplicate task id, unknown dependency, dependency
 * cycle, missing strategy). Detected before any task runs.
 */
public class PlanValidationException extends RuntimeException {

    private final String planId;

    public PlanValidationException(String planId, String message) {
        super(message);
        this.planId = planId;
    }

    public String getPlanId() {
        return planId;
    }
}
