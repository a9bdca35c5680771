package com.taskweave.core.model;

/**
 * Guard evaluated before each attempt; a task whose condition is false is skipped.
 */
@FunctionalInterface
public interface TaskCondition {

    boolean shouldRun(Object input, TaskContext context) throws Exception;
}
