package com.enterpriseagent.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for run and dispatch events.
 * <p>
 * An event's {@code runId} is its scope: a run id ({@code RUN-...}) or a
 * dispatch id ({@code DSP-...}). Scoped listeners see only their scope and are
 * dropped once the scope's terminal event ({@code run.completed} or
 * {@code coordinator.completed}) has been delivered. Listeners may narrow
 * delivery to an event-type prefix such as {@code "governance."}.
 * A failing listener never affects the publisher or other listeners.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    static final Set<String> TERMINAL_EVENTS = Set.of("run.completed", "coordinator.completed");

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Listener>> scoped = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Listener> global = new CopyOnWriteArrayList<>();

    public void publish(AgentEvent event) {
        log.debug("Publishing {} for {}", event.eventType(), event.runId());

        List<Listener> scopeListeners = event.runId() == null ? null : scoped.get(event.runId());
        if (scopeListeners != null) {
            scopeListeners.forEach(listener -> listener.deliver(event));
            if (TERMINAL_EVENTS.contains(event.eventType())) {
                scoped.remove(event.runId(), scopeListeners);
            }
        }
        global.forEach(listener -> listener.deliver(event));
    }

    /**
     * Subscribe to every event of one run or dispatch.
     */
    public Subscription subscribe(String scopeId, Consumer<AgentEvent> consumer) {
        return subscribe(scopeId, "", consumer);
    }

    /**
     * Subscribe to events of one run or dispatch whose type starts with {@code typePrefix}.
     * The subscription ends by itself after the scope's terminal event.
     */
    public Subscription subscribe(String scopeId, String typePrefix, Consumer<AgentEvent> consumer) {
        var listener = new Listener(typePrefix, consumer);
        scoped.computeIfAbsent(scopeId, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> scoped.computeIfPresent(scopeId, (k, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    public Subscription subscribeAll(Consumer<AgentEvent> consumer) {
        return subscribeAll("", consumer);
    }

    public Subscription subscribeAll(String typePrefix, Consumer<AgentEvent> consumer) {
        var listener = new Listener(typePrefix, consumer);
        global.add(listener);
        return () -> global.remove(listener);
    }

    int scopeCount() {
        return scoped.size();
    }

    /**
     * Handle for ending a subscription; usable in try-with-resources around a run.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {

        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }

    private record Listener(String typePrefix, Consumer<AgentEvent> consumer) {

        void deliver(AgentEvent event) {
            if (!typePrefix.isEmpty() && !event.eventType().startsWith(typePrefix)) {
                return;
            }
            try {
                consumer.accept(event);
            } catch (Exception e) {
                log.warn("Listener failed on {} for {}: {}", event.eventType(), event.runId(), e.getMessage(), e);
            }
        }
    }
}
