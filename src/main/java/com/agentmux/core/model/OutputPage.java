package com.agentmux.core.model;

import com.agentmux.core.buffer.BufferedMessage;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A page of buffered session output.
 *
 * @param sessionId     session id
 * @param messages      messages in sequence order
 * @param truncated     true if messages at the requested offset had already been evicted
 * @param nextOffset    offset for the following read
 * @param hasMore       true if messages beyond this page were already buffered when it was read
 * @param state         session state at read time
 * @param working       whether the session was producing output at read time
 * @param totalMessages messages appended over the session's lifetime
 */
public record OutputPage(
        @JsonProperty("session_id") String sessionId,
        List<BufferedMessage> messages,
        boolean truncated,
        @JsonProperty("next_offset") long nextOffset,
        @JsonProperty("has_more") boolean hasMore,
        SessionState state,
        boolean working,
        @JsonProperty("total_messages") long totalMessages
) {

    public OutputPage {
        messages = List.copyOf(messages);
    }
}
