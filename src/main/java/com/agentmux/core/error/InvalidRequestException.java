package com.agentmux.core.error;

/**
 * Thrown when a caller passes out-of-range arguments, such as a negative read offset.
 */
public class InvalidRequestException extends AgentmuxException {

    public InvalidRequestException(String message) {
        super(ErrorKind.INVALID_REQUEST, message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(ErrorKind.INVALID_REQUEST, message, cause);
    }
}
