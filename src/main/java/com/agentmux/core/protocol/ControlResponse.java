package com.agentmux.core.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * The agent's reply to a control request the orchestrator sent, such as {@code initialize}.
 */
public record ControlResponse(
        @JsonProperty("request_id") String requestId,
        String subtype,
        Map<String, Object> response,
        String error
) implements ProtocolMessage {

    public boolean isSuccess() {
        return "success".equals(subtype);
    }
}
