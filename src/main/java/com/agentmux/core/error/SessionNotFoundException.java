package com.agentmux.core.error;

public class SessionNotFoundException extends AgentmuxException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super(ErrorKind.SESSION_NOT_FOUND, "Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
