package com.agentmux.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory delivery of session lifecycle events to listeners of one session and to
 * global listeners.
 * <p>
 * Delivery is synchronous on the publishing thread, which is a session's read loop or a
 * caller changing its state, so listeners must not block. A listener that throws is logged
 * and does not affect the others. Listeners of a session are dropped once its
 * {@link SessionEvent.Type#EVICTED} event has been delivered.
 */
@Service
public class SessionEventBus {

    private static final Logger log = LoggerFactory.getLogger(SessionEventBus.class);

    /** Per-session listeners keyed by session id. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<SessionEvent>>> sessionListeners =
            new ConcurrentHashMap<>();

    /** Listeners that receive events from all sessions. */
    private final CopyOnWriteArrayList<Consumer<SessionEvent>> globalListeners = new CopyOnWriteArrayList<>();

    public void publish(SessionEvent event) {
        log.debug("Publishing {} {} for session {}", event.type(), event.state(), event.sessionId());

        List<Consumer<SessionEvent>> listeners = event.type() == SessionEvent.Type.EVICTED
                ? sessionListeners.remove(event.sessionId())
                : sessionListeners.get(event.sessionId());
        if (listeners != null) {
            for (Consumer<SessionEvent> listener : listeners) {
                deliver(listener, event);
            }
        }
        for (Consumer<SessionEvent> listener : globalListeners) {
            deliver(listener, event);
        }
    }

    /**
     * Registers a listener for one session until it is evicted or the subscription is cancelled.
     */
    public Subscription subscribe(String sessionId, Consumer<SessionEvent> listener) {
        sessionListeners.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> sessionListeners.computeIfPresent(sessionId, (k, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    public Subscription subscribeAll(Consumer<SessionEvent> listener) {
        globalListeners.add(listener);
        return () -> globalListeners.remove(listener);
    }

    /** Listeners currently registered for one session. */
    public int listenerCount(String sessionId) {
        List<Consumer<SessionEvent>> listeners = sessionListeners.get(sessionId);
        return listeners == null ? 0 : listeners.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliver(Consumer<SessionEvent> listener, SessionEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} event for session {}: {}",
                    event.type(), event.sessionId(), e.getMessage(), e);
        }
    }
}
