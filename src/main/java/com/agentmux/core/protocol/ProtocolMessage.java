package com.agentmux.core.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A decoded inbound frame. The set of variants is closed; frames of an
 * unrecognised {@code type} decode to {@link UnknownFrame}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AssistantOutput.class, name = "assistant_output"),
        @JsonSubTypes.Type(value = UserEcho.class, name = "user_echo"),
        @JsonSubTypes.Type(value = ToolInvocation.class, name = "tool_invocation"),
        @JsonSubTypes.Type(value = ToolResult.class, name = "tool_result"),
        @JsonSubTypes.Type(value = ControlRequest.class, name = "control_request"),
        @JsonSubTypes.Type(value = ControlResponse.class, name = "control_response"),
        @JsonSubTypes.Type(value = LifecycleEvent.class, name = "lifecycle"),
        @JsonSubTypes.Type(value = UnknownFrame.class, name = "unknown")
})
public sealed interface ProtocolMessage
        permits AssistantOutput, UserEcho, ToolInvocation, ToolResult,
                ControlRequest, ControlResponse, LifecycleEvent, UnknownFrame {
}
