package com.taskweave.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static EngineEvent event(String type, String executionId) {
        return EngineEvent.of(type, executionId, type.startsWith("task.") ? "fetch" : null, Map.of());
    }

    private static List<String> types(List<EngineEvent> events) {
        return events.stream().map(EngineEvent::eventType).toList();
    }

    @Nested
    @DisplayName("run-bound listeners")
    class RunListenerTests {

        @Test
        @DisplayName("receive only their own run's events")
        void scopedToRun() {
            List<EngineEvent> received = new ArrayList<>();
            eventBus.subscribe("E-1", received::add);

            eventBus.publish(event("task.started", "E-1"));
            eventBus.publish(event("task.started", "E-2"));

            assertEquals(1, received.size());
            assertEquals("E-1", received.get(0).executionId());
        }

        @Test
        @DisplayName("are released after the run's terminal event, which they still receive")
        void releasedOnTerminalEvent() {
            List<EngineEvent> received = new ArrayList<>();
            eventBus.subscribe("E-1", received::add);
            assertEquals(1, eventBus.boundExecutions());

            eventBus.publish(event("task.completed", "E-1"));
            eventBus.publish(event(EngineEvent.EXECUTION_COMPLETED, "E-1"));
            eventBus.publish(event("task.log", "E-1"));

            assertEquals(List.of("task.completed", "execution.completed"), types(received));
            assertEquals(0, eventBus.boundExecutions());
        }

        @Test
        @DisplayName("a failed run releases its listeners too")
        void releasedOnFailure() {
            eventBus.subscribe("E-1", e -> { });
            eventBus.publish(event(EngineEvent.EXECUTION_FAILED, "E-1"));
            assertEquals(0, eventBus.boundExecutions());
        }

        @Test
        @DisplayName("unsubscribing the last listener unbinds the run")
        void unsubscribeUnbinds() {
            List<EngineEvent> received = new ArrayList<>();
            var subscription = eventBus.subscribe("E-1", received::add);

            subscription.unsubscribe();
            eventBus.publish(event("task.started", "E-1"));

            assertTrue(received.isEmpty());
            assertEquals(0, eventBus.boundExecutions());
        }
    }

    @Nested
    @DisplayName("type patterns")
    class TypePatternTests {

        @Test
        @DisplayName("a family pattern matches every type of that family")
        void familyPattern() {
            List<EngineEvent> tasks = new ArrayList<>();
            eventBus.subscribeAll("task.*", tasks::add);

            eventBus.publish(event("execution.started", "E-1"));
            eventBus.publish(event("task.started", "E-1"));
            eventBus.publish(event("task.retrying", "E-1"));
            eventBus.publish(event("compensation.failed", "E-1"));

            assertEquals(List.of("task.started", "task.retrying"), types(tasks));
        }

        @Test
        @DisplayName("an exact pattern matches one type only")
        void exactPattern() {
            List<EngineEvent> retries = new ArrayList<>();
            eventBus.subscribe("E-1", "task.retrying", retries::add);

            eventBus.publish(event("task.started", "E-1"));
            eventBus.publish(event("task.retrying", "E-1"));

            assertEquals(List.of("task.retrying"), types(retries));
        }

        @Test
        @DisplayName("a filtered run listener is still released by the terminal event")
        void filteredListenerReleased() {
            List<EngineEvent> tasks = new ArrayList<>();
            eventBus.subscribe("E-1", "task.*", tasks::add);

            eventBus.publish(event(EngineEvent.EXECUTION_COMPLETED, "E-1"));

            assertTrue(tasks.isEmpty());
            assertEquals(0, eventBus.boundExecutions());
        }

        @Test
        @DisplayName("blank pattern is rejected")
        void blankPattern() {
            assertThrows(IllegalArgumentException.class, () -> eventBus.subscribeAll(" ", e -> { }));
        }

        @Test
        @DisplayName("family() is the part before the first dot")
        void family() {
            assertEquals("task", event("task.retrying", "E-1").family());
            assertEquals("execution", event("execution.completed", "E-1").family());
            assertTrue(event("execution.completed", "E-1").isTerminal());
            assertFalse(event("execution.cancelled", "E-1").isTerminal());
        }
    }

    @Nested
    @DisplayName("robustness")
    class RobustnessTests {

        @Test
        @DisplayName("a throwing listener does not block the others")
        void throwingListener() {
            List<EngineEvent> received = new ArrayList<>();
            eventBus.subscribe("E-1", e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribeAll(received::add);

            eventBus.publish(event("task.started", "E-1"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("concurrent publishers lose no events")
        void concurrentPublishes() throws InterruptedException {
            CopyOnWriteArrayList<EngineEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribeAll("task.*", received::add);

            int threads = 8;
            int perThread = 50;
            CountDownLatch done = new CountDownLatch(threads);
            for (int t = 0; t < threads; t++) {
                String executionId = "E-" + t;
                new Thread(() -> {
                    for (int i = 0; i < perThread; i++) {
                        eventBus.publish(event("task.log", executionId));
                    }
                    done.countDown();
                }).start();
            }

            assertTrue(done.await(10, TimeUnit.SECONDS));
            assertEquals(threads * perThread, received.size());
        }
    }
}
