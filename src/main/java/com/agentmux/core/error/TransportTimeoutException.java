package com.agentmux.core.error;

/**
 * Thrown when a launch, write or read on a transport exceeds its I/O timeout.
 */
public class TransportTimeoutException extends AgentmuxException {

    public TransportTimeoutException(String message) {
        super(ErrorKind.TIMEOUT, message);
    }

    public TransportTimeoutException(String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
    }
}
