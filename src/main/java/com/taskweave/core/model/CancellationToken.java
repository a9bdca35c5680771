package com.taskweave.core.model;

/**
 * Read side of a run's cancellation switch, handed to task bodies.
 * <p>
 * Cancellation is cooperative: the engine stops waiting for a cancelled body but
 * cannot stop the body itself. Long-running bodies should call
 * {@link #throwIfCancelled()} at their own suspension points.
 */
public interface CancellationToken {

    boolean isCancelled();

    /**
     * Registers a callback run once when the switch flips, or immediately if it
     * already has.
     *
     * @return a handle that removes the callback
     */
    Registration onCancel(Runnable callback);

    default void throwIfCancelled() {
        if (isCancelled()) {
            throw new TaskCancelledException("Task cancelled");
        }
    }

    @FunctionalInterface
    interface Registration {
        void remove();
    }
}
