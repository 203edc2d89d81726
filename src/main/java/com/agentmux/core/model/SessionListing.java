package com.agentmux.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * All sessions known to the registry, split by whether they are still running.
 */
public record SessionListing(
        @JsonProperty("active_sessions") List<SessionInfo> activeSessions,
        @JsonProperty("completed_sessions") List<SessionInfo> completedSessions,
        @JsonProperty("total_active") int totalActive,
        @JsonProperty("total_completed") int totalCompleted
) {

    public SessionListing {
        activeSessions = List.copyOf(activeSessions);
        completedSessions = List.copyOf(completedSessions);
    }
}
