package com.agentmux.core.protocol;

import com.agentmux.core.error.ProtocolDecodeException;

/**
 * Outcome of decoding one frame: either a message or the error for that frame alone.
 *
 * @param message   the decoded message, null on error
 * @param error     the decode error, null on success
 * @param sizeBytes frame length in bytes, excluding the line terminator
 */
public record DecodedFrame(ProtocolMessage message, ProtocolDecodeException error, int sizeBytes) {

    public static DecodedFrame of(ProtocolMessage message, int sizeBytes) {
        return new DecodedFrame(message, null, sizeBytes);
    }

    public static DecodedFrame failed(ProtocolDecodeException error, int sizeBytes) {
        return new DecodedFrame(null, error, sizeBytes);
    }

    public boolean isError() {
        return error != null;
    }
}
