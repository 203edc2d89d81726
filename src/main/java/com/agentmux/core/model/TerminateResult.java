package com.agentmux.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Summary returned when a session is terminated.
 *
 * @param sessionId     session id
 * @param state         terminal state; {@link SessionState#TERMINATED} unless the session had already ended
 * @param promptCount   prompts written over the session's lifetime
 * @param turnCount     final turn count reported by the agent
 * @param totalMessages messages appended over the session's lifetime
 * @param runtimeMs     time from creation to end
 */
public record TerminateResult(
        @JsonProperty("session_id") String sessionId,
        SessionState state,
        @JsonProperty("prompt_count") int promptCount,
        @JsonProperty("turn_count") int turnCount,
        @JsonProperty("total_messages") long totalMessages,
        @JsonProperty("runtime_ms") long runtimeMs
) {}
