package com.taskweave.core.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PauseGateTest {

    private final CancellationSignal signal = new CancellationSignal();
    private final PauseGate gate = new PauseGate(signal);

    @Test
    @DisplayName("pause and resume report whether the state changed")
    void pauseResumeTransitions() {
        assertFalse(gate.resume());
        assertTrue(gate.pause());
        assertFalse(gate.pause());
        assertTrue(gate.isPaused());
        assertTrue(gate.resume());
        assertFalse(gate.isPaused());
    }

    @Test
    @DisplayName("an open gate does not block or invoke the hold callback")
    void openGatePassesThrough() throws InterruptedException {
        var holds = new AtomicInteger();
        gate.awaitOpen(signal, holds::incrementAndGet);
        assertEquals(0, holds.get());
    }

    @Test
    @DisplayName("a closed gate holds the caller until resume")
    void closedGateHoldsUntilResume() throws InterruptedException {
        gate.pause();
        var held = new CountDownLatch(1);
        var passed = new CountDownLatch(1);

        new Thread(() -> {
            try {
                gate.awaitOpen(signal, held::countDown);
                passed.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }).start();

        assertTrue(held.await(5, TimeUnit.SECONDS));
        assertFalse(passed.await(50, TimeUnit.MILLISECONDS));

        gate.resume();
        assertTrue(passed.await(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("cancellation releases paused waiters")
    void cancellationReleasesWaiters() throws InterruptedException {
        gate.pause();
        var held = new CountDownLatch(1);
        var passed = new CountDownLatch(1);

        new Thread(() -> {
            try {
                gate.awaitOpen(signal, held::countDown);
                passed.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }).start();

        assertTrue(held.await(5, TimeUnit.SECONDS));
        signal.trip();
        assertTrue(passed.await(5, TimeUnit.SECONDS));
        assertTrue(gate.isPaused());
    }
}
