package com.taskweave.core.engine;

import com.taskweave.core.model.TaskCancelledException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationSignalTest {

    @Test
    @DisplayName("trip flips the switch once")
    void tripOnce() {
        var signal = new CancellationSignal();
        assertFalse(signal.isCancelled());
        assertTrue(signal.trip());
        assertFalse(signal.trip());
        assertTrue(signal.isCancelled());
    }

    @Test
    @DisplayName("callbacks run exactly once, including late registrations")
    void callbacksRunOnce() {
        var signal = new CancellationSignal();
        var early = new AtomicInteger();
        var late = new AtomicInteger();
        signal.onCancel(early::incrementAndGet);

        signal.trip();
        signal.trip();
        signal.onCancel(late::incrementAndGet);

        assertEquals(1, early.get());
        assertEquals(1, late.get());
    }

    @Test
    @DisplayName("removed registrations are not invoked")
    void removedRegistration() {
        var signal = new CancellationSignal();
        var calls = new AtomicInteger();
        signal.onCancel(calls::incrementAndGet).remove();

        signal.trip();

        assertEquals(0, calls.get());
    }

    @Test
    @DisplayName("a failing callback does not stop the others")
    void failingCallback() {
        var signal = new CancellationSignal();
        var calls = new AtomicInteger();
        signal.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        signal.onCancel(calls::incrementAndGet);

        assertTrue(signal.trip());
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("await returns false on timeout and true once tripped")
    void await() throws InterruptedException {
        var signal = new CancellationSignal();
        assertFalse(signal.await(Duration.ofMillis(20)));

        new Thread(() -> {
            sleep(30);
            signal.trip();
        }).start();
        assertTrue(signal.await(Duration.ofSeconds(5)));
    }

    @Test
    @DisplayName("throwIfCancelled raises after trip")
    void throwIfCancelled() {
        var signal = new CancellationSignal();
        assertDoesNotThrow(signal::throwIfCancelled);
        signal.trip();
        assertThrows(TaskCancelledException.class, signal::throwIfCancelled);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
