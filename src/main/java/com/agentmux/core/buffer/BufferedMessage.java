package com.agentmux.core.buffer;

import com.agentmux.core.protocol.ProtocolMessage;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * A message as stored in a session's buffer. Immutable once appended.
 *
 * @param sequence  position in the session's output, assigned at append time
 * @param timestamp when the frame was decoded
 * @param payload   the decoded frame
 * @param sizeBytes encoded size of the frame, counted against the buffer's byte cap
 */
public record BufferedMessage(
        long sequence,
        Instant timestamp,
        ProtocolMessage payload,
        @JsonIgnore int sizeBytes
) {}
