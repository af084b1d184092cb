package com.pipewright.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for pipeline events.
 * <p>
 * Listeners subscribe to one run or to every run, optionally narrowed to event types with a
 * given prefix ({@code "feedback."}, {@code "stage."}). Delivery is synchronous on the publishing
 * thread, so a run's listener sees its events in publish order.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Listener>> runListeners =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Listener> globalListeners = new CopyOnWriteArrayList<>();

    /**
     * Delivers an event to the listeners of its run, then to the global listeners.
     * A listener that throws does not prevent delivery to the others.
     */
    public void publish(PipelineEvent event) {
        log.debug("Publishing {} for run {} ({})", event.eventType(), event.runId(), event.subjectId());

        List<Listener> forRun = event.runId() != null ? runListeners.get(event.runId()) : null;
        if (forRun != null) {
            forRun.forEach(listener -> listener.deliver(event));
        }
        globalListeners.forEach(listener -> listener.deliver(event));
    }

    public Subscription subscribe(String runId, Consumer<PipelineEvent> consumer) {
        return subscribe(runId, "", consumer);
    }

    /**
     * Subscribes to the events of one run whose type starts with {@code typePrefix}.
     *
     * @return a handle that removes the listener; the run's entry goes once its last listener leaves
     */
    public Subscription subscribe(String runId, String typePrefix, Consumer<PipelineEvent> consumer) {
        var listener = new Listener(typePrefix, consumer);
        runListeners.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(listener);
        log.debug("Subscribed to '{}*' events of run {}", typePrefix, runId);
        return () -> runListeners.computeIfPresent(runId, (k, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    public Subscription subscribeAll(Consumer<PipelineEvent> consumer) {
        return subscribeAll("", consumer);
    }

    public Subscription subscribeAll(String typePrefix, Consumer<PipelineEvent> consumer) {
        var listener = new Listener(typePrefix, consumer);
        globalListeners.add(listener);
        log.debug("Subscribed to '{}*' events of every run", typePrefix);
        return () -> globalListeners.remove(listener);
    }

    /** Number of runs that currently have listeners. */
    int subscribedRuns() {
        return runListeners.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static final class Listener {
        private final String typePrefix;
        private final Consumer<PipelineEvent> consumer;

        Listener(String typePrefix, Consumer<PipelineEvent> consumer) {
            this.typePrefix = typePrefix == null ? "" : typePrefix;
            this.consumer = consumer;
        }

        void deliver(PipelineEvent event) {
            if (!event.eventType().startsWith(typePrefix)) {
                return;
            }
            try {
                consumer.accept(event);
            } catch (Exception e) {
                log.warn("Listener failed on {} for run {}: {}", event.eventType(), event.runId(), e.getMessage(), e);
            }
        }
    }
}
