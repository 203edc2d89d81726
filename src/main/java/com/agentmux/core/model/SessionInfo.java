package com.agentmux.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of one session. Built from a single read of the session state.
 *
 * @param sessionId        session id
 * @param label            display label
 * @param state            lifecycle state
 * @param working          true if the session produced output within the working threshold
 * @param promptCount      prompts written to the agent, the initial prompt included
 * @param turnCount        turns reported by the agent's latest result frame
 * @param maxTurns         turn budget
 * @param messageCount     messages appended over the session's lifetime
 * @param retainedMessages messages currently readable from the buffer
 * @param runtimeMs        time from creation to end, or to now while running
 * @param createdAt        creation time
 * @param lastActivityAt   time of the last decoded frame or write
 * @param endedAt          time the session reached a terminal state, null while running
 * @param failureReason    why the session failed, null otherwise
 * @param lastOutput       the last few lines of assistant text
 */
public record SessionInfo(
        @JsonProperty("session_id") String sessionId,
        String label,
        SessionState state,
        boolean working,
        @JsonProperty("prompt_count") int promptCount,
        @JsonProperty("turn_count") int turnCount,
        @JsonProperty("max_turns") int maxTurns,
        @JsonProperty("message_count") long messageCount,
        @JsonProperty("retained_messages") int retainedMessages,
        @JsonProperty("runtime_ms") long runtimeMs,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("last_activity_at") Instant lastActivityAt,
        @JsonProperty("ended_at") Instant endedAt,
        @JsonProperty("failure_reason") String failureReason,
        @JsonProperty("last_output") List<String> lastOutput
) {

    public SessionInfo {
        lastOutput = lastOutput == null ? List.of() : List.copyOf(lastOutput);
    }
}
