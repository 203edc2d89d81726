package com.agentmux.core.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * System notices, partial stream events, errors and the per-turn result frame.
 *
 * @param lifecycle which kind of lifecycle frame this is
 * @param subtype   frame subtype, e.g. {@code init} or {@code success}
 * @param error     whether the agent flagged the frame as an error
 * @param numTurns  turns taken so far, present on result frames
 * @param result    final text of a turn, present on result frames
 * @param data      remaining frame fields
 */
public record LifecycleEvent(
        Kind lifecycle,
        String subtype,
        @JsonProperty("is_error") boolean error,
        @JsonProperty("num_turns") Integer numTurns,
        String result,
        Map<String, Object> data
) implements ProtocolMessage {

    public enum Kind { SYSTEM, RESULT, STREAM, ERROR }

    /** A result frame marks the end of a turn. */
    @JsonIgnore
    public boolean isDone() {
        return lifecycle == Kind.RESULT;
    }
}
