package com.taskweave.core.engine;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds dispatch points of a run while the run is paused. Cancellation releases waiters.
 */
final class PauseGate {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition opened = lock.newCondition();
    private boolean paused;

    PauseGate(CancellationSignal signal) {
        signal.onCancel(this::wakeAll);
    }

    boolean pause() {
        lock.lock();
        try {
            if (paused) {
                return false;
            }
            paused = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    boolean resume() {
        lock.lock();
        try {
            if (!paused) {
                return false;
            }
            paused = false;
            opened.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    boolean isPaused() {
        lock.lock();
        try {
            return paused;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks while the gate is closed and the run is not cancelled.
     *
     * @param onHold run once before the first wait, if the caller has to wait at all
     */
    void awaitOpen(CancellationSignal signal, Runnable onHold) throws InterruptedException {
        lock.lock();
        try {
            boolean held = false;
            while (paused && !signal.isCancelled()) {
                if (!held) {
                    held = true;
                    onHold.run();
                }
                opened.await();
            }
        } finally {
            lock.unlock();
        }
    }

    private void wakeAll() {
        lock.lock();
        try {
            opened.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
