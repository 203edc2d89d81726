package com.agentmux.core.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * A decision the agent asks the orchestrator to make, for example whether a tool may run.
 * Arrives from an untrusted peer; fields other than {@code requestId} may be null.
 *
 * @param requestId correlation id to echo in the reply
 * @param subtype   request kind such as {@code can_use_tool} or {@code hook_callback}
 * @param toolName  tool the request concerns, if any
 * @param input     tool input, empty when absent
 * @param payload   the full request object
 */
public record ControlRequest(
        @JsonProperty("request_id") String requestId,
        String subtype,
        @JsonProperty("tool_name") String toolName,
        Map<String, Object> input,
        Map<String, Object> payload
) implements ProtocolMessage {

    public static final String CAN_USE_TOOL = "can_use_tool";
    public static final String HOOK_CALLBACK = "hook_callback";
    public static final String INTERRUPT = "interrupt";
    public static final String INITIALIZE = "initialize";
    public static final String SET_PERMISSION_MODE = "set_permission_mode";
}
