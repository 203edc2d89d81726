package com.agentmux.core.error;

public class SessionNotActiveException extends AgentmuxException {

    private final String sessionId;

    public SessionNotActiveException(String sessionId, String reason) {
        super(ErrorKind.SESSION_NOT_ACTIVE, "Session " + sessionId + " is not active: " + reason);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
