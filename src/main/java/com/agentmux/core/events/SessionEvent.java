package com.agentmux.core.events;

import com.agentmux.core.model.SessionState;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A change in one session's lifecycle.
 *
 * @param type          what happened
 * @param sessionId     the session
 * @param label         the session's display label
 * @param previousState state before a transition; null when spawned
 * @param state         state after the change; for an eviction, the state the session ended in
 * @param reason        why the session failed, null otherwise
 * @param timestamp     when the change happened
 */
public record SessionEvent(
        Type type,
        @JsonProperty("session_id") String sessionId,
        String label,
        @JsonProperty("previous_state") SessionState previousState,
        SessionState state,
        String reason,
        Instant timestamp
) {

    public enum Type {
        SPAWNED,
        TRANSITIONED,
        EVICTED
    }

    public static SessionEvent spawned(String sessionId, String label, Instant at) {
        return new SessionEvent(Type.SPAWNED, sessionId, label, null, SessionState.INITIALIZING, null, at);
    }

    public static SessionEvent transitioned(String sessionId, String label, SessionState from, SessionState to,
                                            String reason, Instant at) {
        return new SessionEvent(Type.TRANSITIONED, sessionId, label, from, to, reason, at);
    }

    public static SessionEvent evicted(String sessionId, String label, SessionState finalState, Instant at) {
        return new SessionEvent(Type.EVICTED, sessionId, label, finalState, finalState, null, at);
    }

    /** True for the transition that ended the session. */
    public boolean isTerminal() {
        return type == Type.TRANSITIONED && state.isTerminal();
    }
}
