package com.shellrelay.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Single path for everything the relay reports: connection transitions, server
 * notifications and command progress.
 * <p>
 * A {@link RelayEvent} with a session id reaches that session's listeners and the
 * firehose listeners; one without (connection and notification events) reaches only
 * the firehose. Listeners run on the publishing thread, which is the transport reader
 * for notifications and the caller of {@code execute} for command events, so they
 * must not block.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<RelayEvent>>> bySession =
            new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<RelayEvent>> firehose = new CopyOnWriteArrayList<>();

    public void publish(RelayEvent event) {
        List<Consumer<RelayEvent>> listeners = listenersFor(event);
        log.debug("{} -> {} listener(s){}", event.eventType(), listeners.size(),
                event.sessionId() != null ? " [session " + event.sessionId() + "]" : "");
        for (Consumer<RelayEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {}: {}", event.eventType(), e.getMessage(), e);
            }
        }
    }

    /**
     * Listens to one session's command events. The session's listener list is dropped
     * with its last subscription, so finished sessions leave nothing behind.
     */
    public Subscription subscribe(String sessionId, Consumer<RelayEvent> listener) {
        bySession.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> bySession.computeIfPresent(sessionId, (k, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    /** Listens to every event, connection-level ones included. */
    public Subscription subscribeAll(Consumer<RelayEvent> listener) {
        firehose.add(listener);
        return () -> firehose.remove(listener);
    }

    private List<Consumer<RelayEvent>> listenersFor(RelayEvent event) {
        List<Consumer<RelayEvent>> listeners = new ArrayList<>();
        if (event.sessionId() != null) {
            List<Consumer<RelayEvent>> session = bySession.get(event.sessionId());
            if (session != null) {
                listeners.addAll(session);
            }
        }
        listeners.addAll(firehose);
        return listeners;
    }

    /**
     * Ends a subscription; usable in try-with-resources to scope a listener to one call.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {

        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }
}
