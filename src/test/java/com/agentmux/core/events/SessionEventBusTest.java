package com.agentmux.core.events;

import com.agentmux.core.model.SessionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SessionEventBusTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private SessionEventBus bus;

    @BeforeEach
    void setUp() {
        bus = new SessionEventBus();
    }

    private static SessionEvent activated(String sessionId) {
        return SessionEvent.transitioned(sessionId, "Agent-1", SessionState.INITIALIZING, SessionState.ACTIVE,
                null, NOW);
    }

    private static SessionEvent completed(String sessionId) {
        return SessionEvent.transitioned(sessionId, "Agent-1", SessionState.ACTIVE, SessionState.COMPLETED,
                null, NOW);
    }

    private static SessionEvent evicted(String sessionId) {
        return SessionEvent.evicted(sessionId, "Agent-1", SessionState.COMPLETED, NOW);
    }

    // -- Event tests ----------------------------------------------------------

    @Nested
    @DisplayName("events")
    class EventTests {

        @Test
        @DisplayName("a spawned event has no previous state")
        void spawnedEvent() {
            SessionEvent event = SessionEvent.spawned("s-1", "Agent-1", NOW);

            assertEquals(SessionEvent.Type.SPAWNED, event.type());
            assertNull(event.previousState());
            assertEquals(SessionState.INITIALIZING, event.state());
            assertFalse(event.isTerminal());
        }

        @Test
        @DisplayName("only a transition into a terminal state is terminal")
        void terminalTransition() {
            assertFalse(activated("s-1").isTerminal());
            assertTrue(completed("s-1").isTerminal());
            assertFalse(evicted("s-1").isTerminal());
        }
    }

    // -- Delivery tests -------------------------------------------------------

    @Nested
    @DisplayName("delivery")
    class DeliveryTests {

        @Test
        @DisplayName("a session listener sees only its own session")
        void sessionListenerSeesOwnSession() {
            List<SessionEvent> received = new ArrayList<>();
            bus.subscribe("s-1", received::add);

            bus.publish(activated("s-2"));
            bus.publish(activated("s-1"));

            assertEquals(List.of(activated("s-1")), received);
        }

        @Test
        @DisplayName("a global listener sees every session")
        void globalListenerSeesAll() {
            List<String> received = new ArrayList<>();
            bus.subscribeAll(e -> received.add(e.sessionId()));

            bus.publish(activated("s-1"));
            bus.publish(activated("s-2"));

            assertEquals(List.of("s-1", "s-2"), received);
        }

        @Test
        @DisplayName("a failing listener does not stop delivery to the others")
        void failingListenerIsIsolated() {
            List<SessionEvent> received = new ArrayList<>();
            bus.subscribe("s-1", e -> {
                throw new IllegalStateException("boom");
            });
            bus.subscribe("s-1", received::add);
            bus.subscribeAll(received::add);

            bus.publish(completed("s-1"));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("concurrent publishes all reach the listener")
        void concurrentPublishes() throws InterruptedException {
            CopyOnWriteArrayList<SessionEvent> received = new CopyOnWriteArrayList<>();
            bus.subscribe("s-1", received::add);

            int threads = 8;
            int perThread = 100;
            CountDownLatch done = new CountDownLatch(threads);
            for (int t = 0; t < threads; t++) {
                new Thread(() -> {
                    for (int i = 0; i < perThread; i++) {
                        bus.publish(activated("s-1"));
                    }
                    done.countDown();
                }).start();
            }

            assertTrue(done.await(10, TimeUnit.SECONDS));
            assertEquals(threads * perThread, received.size());
        }
    }

    // -- Subscription lifetime tests ------------------------------------------

    @Nested
    @DisplayName("subscription lifetime")
    class LifetimeTests {

        @Test
        @DisplayName("unsubscribing stops delivery and frees the session's slot")
        void unsubscribe() {
            List<SessionEvent> received = new ArrayList<>();
            SessionEventBus.Subscription subscription = bus.subscribe("s-1", received::add);

            bus.publish(activated("s-1"));
            subscription.unsubscribe();
            bus.publish(completed("s-1"));

            assertEquals(1, received.size());
            assertEquals(0, bus.listenerCount("s-1"));
        }

        @Test
        @DisplayName("an eviction is delivered once, then the session's listeners are dropped")
        void evictionDropsListeners() {
            List<SessionEvent.Type> received = new ArrayList<>();
            List<SessionEvent.Type> global = new ArrayList<>();
            bus.subscribe("s-1", e -> received.add(e.type()));
            bus.subscribe("s-1", e -> received.add(e.type()));
            bus.subscribeAll(e -> global.add(e.type()));

            bus.publish(evicted("s-1"));
            bus.publish(completed("s-1"));

            assertEquals(List.of(SessionEvent.Type.EVICTED, SessionEvent.Type.EVICTED), received);
            assertEquals(0, bus.listenerCount("s-1"));
            assertEquals(List.of(SessionEvent.Type.EVICTED, SessionEvent.Type.TRANSITIONED), global);
        }

        @Test
        @DisplayName("unsubscribing after eviction is harmless")
        void unsubscribeAfterEviction() {
            SessionEventBus.Subscription subscription = bus.subscribe("s-1", e -> { });
            bus.publish(evicted("s-1"));

            assertDoesNotThrow(subscription::unsubscribe);
            assertEquals(0, bus.listenerCount("s-1"));
        }
    }
}
