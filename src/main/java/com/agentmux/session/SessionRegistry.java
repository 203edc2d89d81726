package com.agentmux.session;

import com.agentmux.core.buffer.BufferSlice;
import com.agentmux.core.buffer.CircularMessageBuffer;
import com.agentmux.core.error.AgentmuxException;
import com.agentmux.core.error.CapacityExceededException;
import com.agentmux.core.error.InvalidRequestException;
import com.agentmux.core.error.SessionNotFoundException;
import com.agentmux.core.error.SpawnFailedException;
import com.agentmux.core.events.SessionEvent;
import com.agentmux.core.events.SessionEventBus;
import com.agentmux.core.metrics.AgentmuxMetrics;
import com.agentmux.core.model.OutputPage;
import com.agentmux.core.model.SessionInfo;
import com.agentmux.core.model.SessionListing;
import com.agentmux.core.model.SessionState;
import com.agentmux.core.model.SpawnOptions;
import com.agentmux.core.model.SpawnRequest;
import com.agentmux.core.model.TerminateResult;
import com.agentmux.core.security.ControlRequestPolicy;
import com.agentmux.transport.LaunchSpec;
import com.agentmux.transport.TransportFactory;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Owns every agent session and is the entry point for all caller operations.
 * <p>
 * The session map is the only state shared across callers; each operation touches it with a
 * single atomic map call and never holds a lock while doing I/O. A live-session counter,
 * reserved before any process is started and released when a session reaches a terminal
 * state, enforces the concurrency ceiling. Finished sessions stay queryable for the retention
 * window and are then evicted by a periodic cleanup task.
 */
@Service
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private static final String DEFAULT_LABEL = "Agent";
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private static final Comparator<SessionInfo> WORKING_FIRST =
            Comparator.comparing(SessionInfo::working).reversed()
                    .thenComparing(Comparator.comparingLong(SessionInfo::runtimeMs).reversed());

    private final SessionProperties properties;
    private final TransportFactory transportFactory;
    private final ControlRequestPolicy controlRequestPolicy;
    private final SessionEventBus eventBus;
    private final AgentmuxMetrics metrics;
    private final Clock clock;

    private final ConcurrentHashMap<String, AgentSession> sessions = new ConcurrentHashMap<>();
    private final AtomicInteger liveSessions = new AtomicInteger();

    private final ScheduledExecutorService cleanupScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "agentmux-session-cleanup");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SessionRegistry(SessionProperties properties,
                           TransportFactory transportFactory,
                           ControlRequestPolicy controlRequestPolicy,
                           SessionEventBus eventBus,
                           @Autowired(required = false) AgentmuxMetrics metrics) {
        this(properties, transportFactory, controlRequestPolicy, eventBus, metrics, Clock.systemUTC());
    }

    SessionRegistry(SessionProperties properties,
                    TransportFactory transportFactory,
                    ControlRequestPolicy controlRequestPolicy,
                    SessionEventBus eventBus,
                    AgentmuxMetrics metrics,
                    Clock clock) {
        this.properties = properties;
        this.transportFactory = transportFactory;
        this.controlRequestPolicy = controlRequestPolicy;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    @PostConstruct
    void startCleanup() {
        int interval = properties.getCleanupIntervalSeconds();
        cleanupScheduler.scheduleAtFixedRate(this::runCleanup, interval, interval, TimeUnit.SECONDS);
        log.info("Session cleanup scheduled (interval={}s, retention={}s)", interval, properties.getRetentionSeconds());
    }

    /**
     * Terminates every running session and stops the cleanup task.
     */
    @PreDestroy
    public void shutdown() {
        cleanupScheduler.shutdownNow();

        List<CompletableFuture<Void>> pending = new ArrayList<>();
        for (AgentSession session : sessions.values()) {
            if (!session.state().isTerminal()) {
                pending.add(CompletableFuture.runAsync(session::terminate));
            }
        }
        if (pending.isEmpty()) {
            return;
        }
        log.info("Terminating {} running session(s)", pending.size());
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                    .get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Not all sessions terminated cleanly during shutdown: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // -- Spawn ----------------------------------------------------------------

    /**
     * Starts {@code workerCount} sessions (one by default) running the same prompt and returns
     * their ids without waiting for any output.
     *
     * @throws SpawnFailedException       if the request is invalid or a process cannot be launched
     * @throws CapacityExceededException  if the sessions would exceed the concurrency ceiling;
     *                                    nothing is launched in that case
     */
    public List<String> spawn(SpawnRequest request) {
        String prompt = request.prompt();
        if (prompt == null || prompt.isBlank()) {
            throw new SpawnFailedException("Prompt must not be blank");
        }
        SpawnOptions options = request.options();
        int maxTurns = options.maxTurns() != null ? options.maxTurns() : properties.getDefaultMaxTurns();
        if (maxTurns < 1 || maxTurns > properties.getMaxTurnsCeiling()) {
            throw new SpawnFailedException("max_turns must be between 1 and " + properties.getMaxTurnsCeiling()
                    + ", got " + maxTurns);
        }
        int workers = options.workerCount() != null ? options.workerCount() : 1;
        if (workers < 1 || workers > properties.getMaxConcurrentSessions()) {
            throw new SpawnFailedException("worker_count must be between 1 and "
                    + properties.getMaxConcurrentSessions() + ", got " + workers);
        }

        LaunchSpec launchSpec = transportFactory.prepare(options, maxTurns);
        reserve(workers);

        String baseLabel = options.label() != null && !options.label().isBlank() ? options.label() : DEFAULT_LABEL;
        List<AgentSession> spawned = new ArrayList<>(workers);
        for (int i = 1; i <= workers; i++) {
            String label = workers == 1 && options.label() != null && !options.label().isBlank()
                    ? baseLabel
                    : baseLabel + "-" + i;
            AgentSession session = newSession(label, prompt, options, maxTurns, launchSpec);
            sessions.put(session.id(), session);
            try {
                session.start();
            } catch (AgentmuxException e) {
                sessions.remove(session.id());
                eventBus.publish(SessionEvent.evicted(session.id(), label, session.state(), clock.instant()));
                rollback(spawned, workers - i);
                if (metrics != null) {
                    metrics.recordSpawn(false);
                }
                throw e;
            }
            spawned.add(session);
            if (metrics != null) {
                metrics.recordSpawn(true);
            }
        }

        List<String> ids = new ArrayList<>(workers);
        for (AgentSession session : spawned) {
            ids.add(session.id());
        }
        log.info("Spawned {} session(s): {}", ids.size(), ids);
        return ids;
    }

    private AgentSession newSession(String label, String prompt, SpawnOptions options, int maxTurns,
                                    LaunchSpec launchSpec) {
        String id = UUID.randomUUID().toString();
        var buffer = new CircularMessageBuffer(properties.getBufferCapacity(), properties.getBufferMaxBytes(), clock);
        var transport = transportFactory.create(id, label, launchSpec);
        return new AgentSession(id, label, prompt, options, maxTurns, buffer, transport,
                controlRequestPolicy, eventBus, metrics, clock, this::onSessionEnded);
    }

    /**
     * Undoes a partially started batch: terminates the sessions already running and returns the
     * slots reserved for sessions never created. The failed session released its own slot.
     */
    private void rollback(List<AgentSession> started, int neverCreated) {
        for (AgentSession session : started) {
            session.terminate();
            sessions.remove(session.id());
        }
        if (neverCreated > 0) {
            liveSessions.addAndGet(-neverCreated);
        }
    }

    private void reserve(int count) {
        int limit = properties.getMaxConcurrentSessions();
        while (true) {
            int live = liveSessions.get();
            if (live + count > limit) {
                if (metrics != null) {
                    metrics.recordCapacityRejection();
                }
                throw new CapacityExceededException(count, live, limit);
            }
            if (liveSessions.compareAndSet(live, live + count)) {
                return;
            }
        }
    }

    private void onSessionEnded(AgentSession session) {
        liveSessions.decrementAndGet();
    }

    // -- Caller operations ----------------------------------------------------

    /**
     * Writes a follow-up prompt to a running session.
     */
    public void sendPrompt(String sessionId, String prompt) {
        if (prompt == null || prompt.isBlank()) {
            throw new InvalidRequestException("Prompt must not be blank");
        }
        require(sessionId).send(prompt);
    }

    /**
     * Reads buffered output from {@code offset}. Valid in every session state.
     */
    public OutputPage getSessionOutput(String sessionId, long offset, int limit) {
        if (offset < 0) {
            throw new InvalidRequestException("offset must be >= 0, got " + offset);
        }
        if (limit < 1) {
            throw new InvalidRequestException("limit must be >= 1, got " + limit);
        }
        AgentSession session = require(sessionId);
        BufferSlice slice = session.read(offset, Math.min(limit, properties.getBufferCapacity()));
        boolean hasMore = slice.nextOffset() < session.buffer().nextSequence();
        return page(session, slice, hasMore);
    }

    /**
     * Reads the last {@code count} buffered messages. {@code hasMore} on the result means older
     * messages are still retained before the page.
     */
    public OutputPage tailSessionOutput(String sessionId, int count) {
        if (count < 1) {
            throw new InvalidRequestException("count must be >= 1, got " + count);
        }
        AgentSession session = require(sessionId);
        BufferSlice slice = session.readTail(Math.min(count, properties.getBufferCapacity()));
        boolean hasMore = !slice.isEmpty() && slice.messages().get(0).sequence() > session.buffer().floor();
        return page(session, slice, hasMore);
    }

    private OutputPage page(AgentSession session, BufferSlice slice, boolean hasMore) {
        SessionInfo info = session.snapshot(properties.getWorkingThresholdMs(), 0);
        return new OutputPage(session.id(), slice.messages(), slice.truncated(), slice.nextOffset(), hasMore,
                info.state(), info.working(), info.messageCount());
    }

    public SessionInfo getSessionInfo(String sessionId) {
        return require(sessionId).snapshot(properties.getWorkingThresholdMs(), properties.getLastOutputLines());
    }

    public SessionListing listSessions() {
        return listSessions(true, properties.getLastOutputLines());
    }

    /**
     * Lists sessions from one snapshot each, running sessions first. Within each group, working
     * sessions come first, then longer-running ones.
     */
    public SessionListing listSessions(boolean includeCompleted, int lastOutputLines) {
        List<SessionInfo> active = new ArrayList<>();
        List<SessionInfo> completed = new ArrayList<>();
        for (AgentSession session : sessions.values()) {
            SessionInfo info = session.snapshot(properties.getWorkingThresholdMs(), lastOutputLines);
            if (info.state().isTerminal()) {
                completed.add(info);
            } else {
                active.add(info);
            }
        }
        active.sort(WORKING_FIRST);
        completed.sort(WORKING_FIRST);
        return new SessionListing(active, includeCompleted ? completed : List.of(), active.size(), completed.size());
    }

    /**
     * Terminates a session. Repeated calls return the same terminal state.
     */
    public TerminateResult terminateSession(String sessionId) {
        TerminateResult result = require(sessionId).terminate();
        log.info("Session {} terminated in state {} after {} ms", sessionId, result.state(), result.runtimeMs());
        return result;
    }

    /**
     * Follows one session's lifecycle. The listener first receives the event for the current
     * state, then every later one until the session is evicted. An event that races the
     * subscription can arrive twice. Later events are delivered on the thread that caused
     * them, so the listener must not block.
     */
    public SessionEventBus.Subscription watchSession(String sessionId, Consumer<SessionEvent> listener) {
        AgentSession session = require(sessionId);
        SessionEventBus.Subscription subscription = eventBus.subscribe(sessionId, listener);
        if (sessions.get(sessionId) != session) {
            // Evicted between the lookup and the subscribe
            subscription.unsubscribe();
            throw new SessionNotFoundException(sessionId);
        }
        listener.accept(session.lastEvent());
        return subscription;
    }

    // -- Cleanup --------------------------------------------------------------

    private void runCleanup() {
        try {
            int evicted = evictExpired();
            if (evicted > 0) {
                log.info("Evicted {} finished session(s)", evicted);
            }
        } catch (RuntimeException e) {
            log.error("Session cleanup failed", e);
        }
    }

    /**
     * Removes sessions that have been terminal for longer than the retention window.
     *
     * @return how many sessions were evicted
     */
    int evictExpired() {
        Instant cutoff = clock.instant().minus(Duration.ofSeconds(properties.getRetentionSeconds()));
        int evicted = 0;
        for (AgentSession session : sessions.values()) {
            Instant endedAt = session.endedAt();
            if (endedAt != null && !endedAt.isAfter(cutoff) && sessions.remove(session.id(), session)) {
                evicted++;
                eventBus.publish(SessionEvent.evicted(session.id(), session.label(), session.state(),
                        clock.instant()));
            }
        }
        return evicted;
    }

    // -- Accessors ------------------------------------------------------------

    public int liveSessionCount() {
        return liveSessions.get();
    }

    public int sessionCount() {
        return sessions.size();
    }

    public int capacity() {
        return properties.getMaxConcurrentSessions();
    }

    public SessionState stateOf(String sessionId) {
        return require(sessionId).state();
    }

    private AgentSession require(String sessionId) {
        if (sessionId == null) {
            throw new SessionNotFoundException("null");
        }
        AgentSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }
}
