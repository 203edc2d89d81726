package com.agentmux.session;

import com.agentmux.core.buffer.BufferSlice;
import com.agentmux.core.buffer.CircularMessageBuffer;
import com.agentmux.core.error.AgentmuxException;
import com.agentmux.core.error.ProtocolDecodeException;
import com.agentmux.core.error.SessionNotActiveException;
import com.agentmux.core.error.TransportIoException;
import com.agentmux.core.error.TransportTimeoutException;
import com.agentmux.core.events.SessionEvent;
import com.agentmux.core.events.SessionEventBus;
import com.agentmux.core.logging.MdcContext;
import com.agentmux.core.metrics.AgentmuxMetrics;
import com.agentmux.core.model.SessionInfo;
import com.agentmux.core.model.SessionState;
import com.agentmux.core.model.SpawnOptions;
import com.agentmux.core.model.TerminateResult;
import com.agentmux.core.protocol.AssistantOutput;
import com.agentmux.core.protocol.ControlRequest;
import com.agentmux.core.protocol.LifecycleEvent;
import com.agentmux.core.protocol.OutboundCommand;
import com.agentmux.core.protocol.ProtocolMessage;
import com.agentmux.core.security.ControlRequestPolicy;
import com.agentmux.core.security.PolicyVerdict;
import com.agentmux.core.security.SessionPolicyContext;
import com.agentmux.transport.SubprocessTransport;
import com.agentmux.transport.TransportClosure;
import com.agentmux.transport.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One agent conversation: a subprocess transport feeding a message buffer, plus the
 * lifecycle state machine.
 * <p>
 * The transport's read loop is the only thread that appends to the buffer, and it drives
 * every output-related transition. Callers may send, read, snapshot and terminate from any
 * thread. State changes go through compare-and-set on an immutable {@link Status}, so a
 * terminal state is reached exactly once and never left.
 */
public class AgentSession implements TransportListener {

    private static final Logger log = LoggerFactory.getLogger(AgentSession.class);

    private static final int MAX_REQUEST_ID_LENGTH = 128;
    private static final int RECENT_OUTPUT_LINES = 20;
    private static final Set<String> PEER_REQUEST_SUBTYPES =
            Set.of(ControlRequest.CAN_USE_TOOL, ControlRequest.HOOK_CALLBACK, "mcp_message");

    /**
     * State plus the facts that are fixed when it was entered, including the event that
     * announced it.
     */
    record Status(SessionState state, Instant endedAt, String failureReason, SessionEvent event) {}

    private final String id;
    private final String label;
    private final String initialPrompt;
    private final int maxTurns;
    private final CircularMessageBuffer buffer;
    private final SubprocessTransport transport;
    private final ControlRequestPolicy policy;
    private final SessionPolicyContext policyContext;
    private final SessionEventBus eventBus;
    private final AgentmuxMetrics metrics;
    private final Clock clock;
    private final Consumer<AgentSession> onTerminal;
    private final Instant createdAt;

    private final AtomicReference<Status> status;
    private final AtomicBoolean terminationRequested = new AtomicBoolean();
    private final AtomicInteger promptCount = new AtomicInteger();
    private final Deque<String> recentOutput = new ArrayDeque<>();

    private volatile int turnCount;
    private volatile boolean sawResult;
    private volatile Instant lastActivityAt;

    public AgentSession(String id,
                        String label,
                        String initialPrompt,
                        SpawnOptions options,
                        int maxTurns,
                        CircularMessageBuffer buffer,
                        SubprocessTransport transport,
                        ControlRequestPolicy policy,
                        SessionEventBus eventBus,
                        AgentmuxMetrics metrics,
                        Clock clock,
                        Consumer<AgentSession> onTerminal) {
        this.id = id;
        this.label = label;
        this.initialPrompt = initialPrompt;
        this.maxTurns = maxTurns;
        this.buffer = buffer;
        this.transport = transport;
        this.policy = policy;
        this.policyContext = new SessionPolicyContext(id, label, options.allowedTools(),
                options.disallowedTools(), options.permissionMode());
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.onTerminal = onTerminal;
        this.createdAt = clock.instant();
        this.lastActivityAt = createdAt;
        this.status = new AtomicReference<>(new Status(SessionState.INITIALIZING, null, null,
                SessionEvent.spawned(id, label, createdAt)));
    }

    // -- Caller operations ----------------------------------------------------

    /**
     * Launches the subprocess and queues the init request and the initial prompt.
     * Does not wait for any output.
     */
    void start() {
        MdcContext.setSession(id, label);
        try {
            eventBus.publish(status.get().event());
            transport.start(this);
            transport.submit(new OutboundCommand.Init(transport.nextRequestId(), Map.of()))
                    .exceptionally(e -> logUndelivered("init request", e));
            transport.submit(new OutboundCommand.Prompt(initialPrompt, null))
                    .exceptionally(e -> logUndelivered("initial prompt", e));
            promptCount.incrementAndGet();
        } catch (AgentmuxException e) {
            transitionTo(SessionState.FAILED, e.getMessage());
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Writes a follow-up prompt and waits until it has been flushed to the agent.
     *
     * @throws SessionNotActiveException if the session has ended or used up its turns
     */
    public void send(String prompt) {
        Status current = status.get();
        if (current.state().isTerminal()) {
            throw new SessionNotActiveException(id, "session is " + current.state());
        }
        if (turnCount >= maxTurns) {
            throw new SessionNotActiveException(id, "max turns (" + maxTurns + ") reached");
        }
        try {
            transport.write(new OutboundCommand.Prompt(prompt, null));
        } catch (TransportTimeoutException e) {
            if (metrics != null) {
                metrics.recordWriteTimeout();
            }
            throw e;
        } catch (TransportIoException e) {
            if (transport.isClosed() || status.get().state().isTerminal()) {
                throw new SessionNotActiveException(id, "session ended");
            }
            throw e;
        }
        promptCount.incrementAndGet();
        lastActivityAt = clock.instant();
    }

    public BufferSlice read(long offset, int limit) {
        return buffer.read(offset, limit);
    }

    public BufferSlice readTail(int count) {
        return buffer.readTail(count);
    }

    /**
     * Stops the subprocess (gracefully, then by force) and marks the session terminated.
     * A session that had already ended keeps its state. Safe to call repeatedly.
     */
    public TerminateResult terminate() {
        terminationRequested.set(true);
        transport.terminate(true);
        transitionTo(SessionState.TERMINATED, null);
        Status current = status.get();
        return new TerminateResult(id, current.state(), promptCount.get(), turnCount,
                buffer.nextSequence(), runtimeMs(current));
    }

    /**
     * A consistent view built from one read of the status.
     */
    public SessionInfo snapshot(long workingThresholdMs, int lastOutputLines) {
        Status current = status.get();
        Instant lastActivity = lastActivityAt;
        boolean working = !current.state().isTerminal()
                && Duration.between(lastActivity, clock.instant()).toMillis() < workingThresholdMs;
        return new SessionInfo(id, label, current.state(), working, promptCount.get(), turnCount, maxTurns,
                buffer.nextSequence(), buffer.size(), runtimeMs(current), createdAt, lastActivity,
                current.endedAt(), current.failureReason(), recentOutput(lastOutputLines));
    }

    // -- Transport callbacks (read-loop thread) -------------------------------

    @Override
    public void onFrame(ProtocolMessage message, int sizeBytes) {
        buffer.append(message, sizeBytes);
        lastActivityAt = clock.instant();
        transitionTo(SessionState.ACTIVE, null);

        if (message instanceof AssistantOutput output) {
            rememberOutput(output.text());
        } else if (message instanceof ControlRequest request) {
            answer(request);
        } else if (message instanceof LifecycleEvent event && event.isDone()) {
            onTurnResult(event);
        }
    }

    @Override
    public void onDecodeError(ProtocolDecodeException error) {
        lastActivityAt = clock.instant();
        log.warn("Discarding undecodable frame from session {}: {}", id, error.getMessage());
        if (metrics != null) {
            metrics.recordDecodeError();
        }
    }

    @Override
    public void onClosed(TransportClosure closure) {
        if (terminationRequested.get()) {
            transitionTo(SessionState.TERMINATED, null);
        } else if (closure.cause() != null) {
            transitionTo(SessionState.FAILED, closure.cause().getMessage());
        } else if (closure.exitCode() == null) {
            transitionTo(SessionState.FAILED, "Agent exit status unknown");
        } else if (closure.exitCode() != 0) {
            transitionTo(SessionState.FAILED, "Agent exited with status " + closure.exitCode()
                    + stderrHint(closure.stderrTail()));
        } else if (!sawResult) {
            transitionTo(SessionState.FAILED, "Agent output ended before a result frame");
        } else {
            transitionTo(SessionState.COMPLETED, null);
        }
    }

    private void onTurnResult(LifecycleEvent result) {
        sawResult = true;
        if (result.numTurns() != null) {
            turnCount = result.numTurns();
        } else {
            turnCount = turnCount + 1;
        }
        if (result.error()) {
            log.warn("Session {} turn ended with error result: {}", id, result.subtype());
        }
        if (turnCount >= maxTurns) {
            log.info("Session {} reached its turn budget ({}); ending input", id, maxTurns);
            transport.endInput();
        }
    }

    private void answer(ControlRequest request) {
        String requestId = request.requestId();
        if (requestId == null || requestId.isBlank() || requestId.length() > MAX_REQUEST_ID_LENGTH) {
            log.warn("Ignoring control request from session {} with unusable request id", id);
            return;
        }

        OutboundCommand.ControlReply reply;
        if (request.subtype() == null || !PEER_REQUEST_SUBTYPES.contains(request.subtype())) {
            log.warn("Rejecting unsupported control request '{}' from session {}", request.subtype(), id);
            reply = OutboundCommand.ControlReply.error(requestId,
                    "Unsupported control request subtype: " + request.subtype());
        } else {
            reply = decide(request);
        }
        transport.submit(reply).exceptionally(e -> logUndelivered("control response", e));
    }

    private OutboundCommand.ControlReply decide(ControlRequest request) {
        PolicyVerdict verdict;
        try {
            verdict = policy.decide(policyContext, request);
        } catch (RuntimeException e) {
            log.error("Control policy failed on {} for session {}", request.subtype(), id, e);
            return OutboundCommand.ControlReply.error(request.requestId(), "Policy evaluation failed");
        }
        if (metrics != null) {
            metrics.recordControlVerdict(request.subtype(), verdict.allowed());
        }
        if (!verdict.allowed()) {
            log.info("Denied {} for session {}: {}", request.subtype(), id, verdict.message());
        }
        return OutboundCommand.ControlReply.success(request.requestId(), verdict.payload());
    }

    // -- State ----------------------------------------------------------------

    /**
     * Moves to {@code target} unless the session is already there or terminal.
     *
     * @return true if this call made the transition
     */
    private boolean transitionTo(SessionState target, String failureReason) {
        Status current;
        Status next;
        do {
            current = status.get();
            if (current.state().isTerminal() || current.state() == target) {
                return false;
            }
            Instant now = clock.instant();
            String reason = target.isTerminal() ? failureReason : null;
            next = new Status(target, target.isTerminal() ? now : null, reason,
                    SessionEvent.transitioned(id, label, current.state(), target, reason, now));
        } while (!status.compareAndSet(current, next));

        onTransition(current.state(), next);
        return true;
    }

    private void onTransition(SessionState from, Status to) {
        if (to.state() == SessionState.FAILED) {
            log.warn("Session {} ({}) failed: {}", id, label, to.failureReason());
        } else {
            log.info("Session {} ({}) {} -> {}", id, label, from, to.state());
        }
        eventBus.publish(to.event());

        if (to.state().isTerminal()) {
            if (metrics != null) {
                metrics.recordSessionEnded(to.state().name(), runtimeMs(to));
            }
            onTerminal.accept(this);
        }
    }

    private long runtimeMs(Status current) {
        Instant end = current.endedAt() != null ? current.endedAt() : clock.instant();
        return Math.max(0, Duration.between(createdAt, end).toMillis());
    }

    private void rememberOutput(String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        synchronized (recentOutput) {
            for (String line : text.split("\n")) {
                if (line.isBlank()) {
                    continue;
                }
                if (recentOutput.size() == RECENT_OUTPUT_LINES) {
                    recentOutput.removeFirst();
                }
                recentOutput.addLast(line);
            }
        }
    }

    private List<String> recentOutput(int lines) {
        if (lines <= 0) {
            return List.of();
        }
        synchronized (recentOutput) {
            List<String> all = new ArrayList<>(recentOutput);
            return all.subList(Math.max(0, all.size() - lines), all.size());
        }
    }

    private static String stderrHint(List<String> stderrTail) {
        if (stderrTail.isEmpty()) {
            return "";
        }
        return ": " + stderrTail.get(stderrTail.size() - 1);
    }

    private Void logUndelivered(String what, Throwable error) {
        log.warn("Could not deliver {} to session {}: {}", what, id, error.getMessage());
        return null;
    }

    // -- Accessors ------------------------------------------------------------

    public String id() {
        return id;
    }

    public String label() {
        return label;
    }

    public SessionState state() {
        return status.get().state();
    }

    /** The event that announced the current state. */
    public SessionEvent lastEvent() {
        return status.get().event();
    }

    /** When the session reached its terminal state, or null while it is running. */
    public Instant endedAt() {
        return status.get().endedAt();
    }

    public String failureReason() {
        return status.get().failureReason();
    }

    public int promptCount() {
        return promptCount.get();
    }

    public int turnCount() {
        return turnCount;
    }

    public int maxTurns() {
        return maxTurns;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public CircularMessageBuffer buffer() {
        return buffer;
    }

    SubprocessTransport transport() {
        return transport;
    }
}
