package com.taskweave.core.engine;

import com.taskweave.core.model.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Set-once cancellation switch for a run. Once tripped it never resets.
 */
public final class CancellationSignal implements CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private final AtomicBoolean tripped = new AtomicBoolean();
    private final CountDownLatch latch = new CountDownLatch(1);
    private final CopyOnWriteArrayList<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * Flips the switch and runs every registered callback.
     *
     * @return true if this call flipped it, false if it was already set
     */
    public boolean trip() {
        if (!tripped.compareAndSet(false, true)) {
            return false;
        }
        latch.countDown();
        for (Runnable callback : callbacks) {
            runOnce(callback);
        }
        return true;
    }

    @Override
    public boolean isCancelled() {
        return tripped.get();
    }

    @Override
    public Registration onCancel(Runnable callback) {
        callbacks.add(callback);
        if (tripped.get()) {
            runOnce(callback);
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Waits up to {@code timeout} for the switch to flip.
     *
     * @return true if the run was cancelled before the timeout elapsed
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (timeout.isZero() || timeout.isNegative()) {
            return isCancelled();
        }
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    // remove() is atomic, so a callback racing between trip() and onCancel() runs once
    private void runOnce(Runnable callback) {
        if (callbacks.remove(callback)) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation callback failed: {}", e.getMessage(), e);
            }
        }
    }
}
