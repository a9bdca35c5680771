package com.taskweave.core.model;

/**
 * The unit of work a {@link Task} performs. Any exception is treated as a task error.
 */
@FunctionalInterface
public interface TaskBody {

    Object execute(Object input, TaskContext context) throws Exception;
}
