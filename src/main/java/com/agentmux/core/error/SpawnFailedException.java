package com.agentmux.core.error;

/**
 * Thrown when a subprocess could not be started or its launch options were rejected.
 */
public class SpawnFailedException extends AgentmuxException {

    public SpawnFailedException(String message) {
        super(ErrorKind.SPAWN_FAILED, message);
    }

    public SpawnFailedException(String message, Throwable cause) {
        super(ErrorKind.SPAWN_FAILED, message, cause);
    }
}
