package com.taskweave.core.logging;

import org.slf4j.MDC;

import java.util.Map;

/**
 * Utility for managing Taskweave-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setExecution(String executionId) {
        MDC.put("executionId", executionId);
    }

    public static void setTask(String executionId, String taskId) {
        MDC.put("executionId", executionId);
        MDC.put("taskId", taskId);
    }

    public static void setAttempt(String executionId, String taskId, int attempt) {
        setTask(executionId, taskId);
        MDC.put("attempt", String.valueOf(attempt));
    }

    /**
     * Wraps {@code task} so it runs with the caller's MDC on whichever thread executes it.
     */
    public static Runnable propagate(Runnable task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (captured != null) {
                MDC.setContextMap(captured);
            } else {
                MDC.clear();
            }
            try {
                task.run();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }

    public static void clear() {
        MDC.remove("executionId");
        MDC.remove("taskId");
        MDC.remove("attempt");
    }
}
