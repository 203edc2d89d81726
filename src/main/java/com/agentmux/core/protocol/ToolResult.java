package com.agentmux.core.protocol;

import java.util.List;

/**
 * A user frame carrying the results of earlier tool calls.
 */
public record ToolResult(List<ContentBlock.ToolResultBlock> results) implements ProtocolMessage {

    public ToolResult {
        results = List.copyOf(results);
    }
}
