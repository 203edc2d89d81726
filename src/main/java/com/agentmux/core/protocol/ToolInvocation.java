package com.agentmux.core.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * An assistant frame that calls one or more tools.
 *
 * @param model    model name reported by the agent, may be null
 * @param toolUses the tool calls, in block order
 * @param content  every block of the frame, including any text preceding the calls
 */
public record ToolInvocation(
        String model,
        @JsonProperty("tool_uses") List<ContentBlock.ToolUseBlock> toolUses,
        List<ContentBlock> content
) implements ProtocolMessage {

    public ToolInvocation {
        toolUses = List.copyOf(toolUses);
        content = List.copyOf(content);
    }
}
