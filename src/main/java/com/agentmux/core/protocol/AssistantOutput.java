package com.agentmux.core.protocol;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Model output without tool calls.
 *
 * @param model   model name reported by the agent, may be null
 * @param content content blocks in the order received
 */
public record AssistantOutput(String model, List<ContentBlock> content) implements ProtocolMessage {

    public AssistantOutput {
        content = List.copyOf(content);
    }

    /** Concatenated text of all text blocks, newline separated. */
    public String text() {
        return content.stream()
                .filter(ContentBlock.TextBlock.class::isInstance)
                .map(b -> ((ContentBlock.TextBlock) b).text())
                .collect(Collectors.joining("\n"));
    }
}
