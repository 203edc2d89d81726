package com.agentmux.core.model;

/**
 * Lifecycle of an agent session.
 * <pre>
 * INITIALIZING -> ACTIVE -> { COMPLETED | FAILED | TERMINATED }
 * INITIALIZING -> { FAILED | TERMINATED }
 * </pre>
 */
public enum SessionState {
    INITIALIZING,
    ACTIVE,
    COMPLETED,
    FAILED,
    TERMINATED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TERMINATED;
    }
}
