package com.agentmux.core.security;

import java.util.Map;

/**
 * Decision on a control request.
 *
 * @param allowed whether the request is granted
 * @param message human-readable reason, mostly for denials
 * @param payload body of the control response sent back to the agent
 */
public record PolicyVerdict(boolean allowed, String message, Map<String, Object> payload) {

    public static PolicyVerdict allow(Map<String, Object> payload) {
        return new PolicyVerdict(true, null, payload);
    }

    public static PolicyVerdict deny(String message, Map<String, Object> payload) {
        return new PolicyVerdict(false, message, payload);
    }
}
