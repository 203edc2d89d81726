package com.agentmux.core.error;

/**
 * Base type for every failure the orchestrator reports. Each subclass maps to
 * exactly one {@link ErrorKind}.
 */
public abstract class AgentmuxException extends RuntimeException {

    private final ErrorKind kind;

    protected AgentmuxException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AgentmuxException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
