package com.agentmux.core.model;

/**
 * Request to start one or more agent sessions with the same initial prompt.
 */
public record SpawnRequest(String prompt, SpawnOptions options) {

    public SpawnRequest {
        options = options == null ? SpawnOptions.defaults() : options;
    }

    public static SpawnRequest of(String prompt) {
        return new SpawnRequest(prompt, SpawnOptions.defaults());
    }
}
