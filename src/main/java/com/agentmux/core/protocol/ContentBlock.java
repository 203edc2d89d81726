package com.agentmux.core.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Map;

/**
 * One block of a message's content array.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ContentBlock.TextBlock.class, name = "text"),
        @JsonSubTypes.Type(value = ContentBlock.ThinkingBlock.class, name = "thinking"),
        @JsonSubTypes.Type(value = ContentBlock.ToolUseBlock.class, name = "tool_use"),
        @JsonSubTypes.Type(value = ContentBlock.ToolResultBlock.class, name = "tool_result"),
        @JsonSubTypes.Type(value = ContentBlock.OtherBlock.class, name = "other")
})
public sealed interface ContentBlock {

    record TextBlock(String text) implements ContentBlock {}

    record ThinkingBlock(String thinking, String signature) implements ContentBlock {}

    record ToolUseBlock(
            String id,
            String name,
            Map<String, Object> input
    ) implements ContentBlock {}

    record ToolResultBlock(
            @JsonProperty("tool_use_id") String toolUseId,
            Object content,
            @JsonProperty("is_error") boolean isError
    ) implements ContentBlock {}

    /** A block type this codec does not model; kept verbatim. */
    record OtherBlock(
            @JsonProperty("block_type") String blockType,
            Map<String, Object> raw
    ) implements ContentBlock {}
}
