package com.taskweave.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Routes engine events to listeners, filtered by run and by event type.
 * <p>
 * Type patterns: {@code "*"} for everything, {@code "task.*"} for a family, or an
 * exact type such as {@code "task.retrying"}. Listeners bound to one run are
 * dropped once that run publishes its terminal event; global listeners live
 * until they unsubscribe.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public static final String ALL_TYPES = "*";

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Listener>> byExecution = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Listener> global = new CopyOnWriteArrayList<>();

    public void publish(EngineEvent event) {
        log.trace("{} [{}] {}", event.eventType(), event.executionId(), event.taskId());

        var runListeners = event.isTerminal()
                ? byExecution.remove(event.executionId())
                : byExecution.get(event.executionId());
        if (runListeners != null) {
            runListeners.forEach(listener -> listener.deliver(event));
            if (event.isTerminal()) {
                log.debug("Run {} finished, released {} listener(s)", event.executionId(), runListeners.size());
            }
        }
        global.forEach(listener -> listener.deliver(event));
    }

    public Subscription subscribe(String executionId, Consumer<EngineEvent> consumer) {
        return subscribe(executionId, ALL_TYPES, consumer);
    }

    /**
     * Listens to one run's events of the given type pattern until the run ends.
     */
    public Subscription subscribe(String executionId, String typePattern, Consumer<EngineEvent> consumer) {
        var listener = new Listener(typePattern, consumer);
        byExecution.computeIfAbsent(executionId, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> byExecution.computeIfPresent(executionId, (k, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    public Subscription subscribeAll(Consumer<EngineEvent> consumer) {
        return subscribeAll(ALL_TYPES, consumer);
    }

    public Subscription subscribeAll(String typePattern, Consumer<EngineEvent> consumer) {
        var listener = new Listener(typePattern, consumer);
        global.add(listener);
        return () -> global.remove(listener);
    }

    /** Runs that still have listeners bound to them. */
    public int boundExecutions() {
        return byExecution.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private record Listener(String typePattern, Consumer<EngineEvent> consumer) {

        Listener {
            if (typePattern == null || typePattern.isBlank()) {
                throw new IllegalArgumentException("Event type pattern must not be blank");
            }
        }

        boolean accepts(EngineEvent event) {
            if (ALL_TYPES.equals(typePattern)) {
                return true;
            }
            if (typePattern.endsWith(".*")) {
                return event.family().equals(typePattern.substring(0, typePattern.length() - 2));
            }
            return typePattern.equals(event.eventType());
        }

        void deliver(EngineEvent event) {
            if (!accepts(event)) {
                return;
            }
            try {
                consumer.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener for {} failed on {}: {}", typePattern, event.eventType(), e.getMessage(), e);
            }
        }
    }
}
