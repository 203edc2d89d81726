package com.agentmux.core.error;

/**
 * Thrown when a single inbound frame cannot be decoded. Decoding resumes at the next frame.
 */
public class ProtocolDecodeException extends AgentmuxException {

    public ProtocolDecodeException(String message) {
        super(ErrorKind.PROTOCOL_DECODE_ERROR, message);
    }

    public ProtocolDecodeException(String message, Throwable cause) {
        super(ErrorKind.PROTOCOL_DECODE_ERROR, message, cause);
    }
}
