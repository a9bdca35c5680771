package com.taskweave.core.engine;

import com.taskweave.core.model.ExecutionResult;
import com.taskweave.core.model.TaskResult;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Task results of a streaming run, in completion order.
 * <p>
 * {@link #hasNext()} blocks until the next task settles or the run ends. Closing
 * the stream cancels the run if it is still in flight. Not restartable.
 */
public final class TaskResultStream implements Iterator<TaskResult>, AutoCloseable {

    private static final Object END = new Object();

    private final String executionId;
    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final CompletableFuture<ExecutionResult> result = new CompletableFuture<>();
    private final Runnable onClose;
    private Object next;
    private boolean finished;

    TaskResultStream(String executionId, Runnable onClose) {
        this.executionId = executionId;
        this.onClose = onClose;
    }

    public String executionId() {
        return executionId;
    }

    /**
     * The run's final result, completed once every task result has been queued.
     */
    public CompletableFuture<ExecutionResult> result() {
        return result;
    }

    @Override
    public boolean hasNext() {
        if (next == null && !finished) {
            Object item = take();
            if (item == END) {
                finished = true;
                if (result.isCompletedExceptionally()) {
                    // surfaces the driver failure to the consumer
                    result.join();
                }
            } else {
                next = item;
            }
        }
        return next != null;
    }

    @Override
    public TaskResult next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Execution " + executionId + " has no more task results");
        }
        var current = (TaskResult) next;
        next = null;
        return current;
    }

    public Stream<TaskResult> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(this::close);
    }

    @Override
    public void close() {
        if (!result.isDone()) {
            onClose.run();
        }
    }

    void push(TaskResult taskResult) {
        queue.add(taskResult);
    }

    void finish(ExecutionResult executionResult) {
        result.complete(executionResult);
        queue.add(END);
    }

    void fail(Throwable failure) {
        result.completeExceptionally(failure);
        queue.add(END);
    }

    private Object take() {
        try {
            return queue.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for results of execution " + executionId, e);
        }
    }
}
