package com.agentmux.core.error;

/**
 * Thrown when the pipes to a subprocess fail or the transport is already closed.
 */
public class TransportIoException extends AgentmuxException {

    public TransportIoException(String message) {
        super(ErrorKind.TRANSPORT_IO_ERROR, message);
    }

    public TransportIoException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT_IO_ERROR, message, cause);
    }
}
