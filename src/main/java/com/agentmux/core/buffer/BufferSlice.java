package com.agentmux.core.buffer;

import java.util.List;

/**
 * Result of a buffer read.
 *
 * @param messages   messages with contiguous ascending sequence numbers
 * @param truncated  true when messages at or after the requested offset were already evicted
 * @param nextOffset offset to pass to the next read to continue without gaps
 */
public record BufferSlice(List<BufferedMessage> messages, boolean truncated, long nextOffset) {

    public BufferSlice {
        messages = List.copyOf(messages);
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }
}
