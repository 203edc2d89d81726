package com.agentmux.core.protocol;

import com.agentmux.core.error.ProtocolDecodeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Line-delimited JSON codec for the agent control protocol.
 * <p>
 * Every frame is one JSON object terminated by {@code \n}. Outbound commands are
 * encoded into complete frames; inbound frames are decoded into {@link ProtocolMessage}
 * variants by their {@code type} field. Stateless and thread-safe; per-stream framing
 * state lives in {@link FrameDecoder}.
 */
public class ControlProtocolCodec {

    public static final int DEFAULT_MAX_FRAME_BYTES = 1024 * 1024;

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final int READ_CHUNK = 8192;

    private final ObjectMapper objectMapper;

    public ControlProtocolCodec() {
        this(new ObjectMapper());
    }

    public ControlProtocolCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // -- Encoding ------------------------------------------------------------

    /**
     * Encodes a command as a single complete frame, trailing newline included.
     */
    public byte[] encode(OutboundCommand command) {
        ObjectNode frame = toFrame(command);
        try {
            byte[] json = objectMapper.writeValueAsBytes(frame);
            byte[] line = new byte[json.length + 1];
            System.arraycopy(json, 0, line, 0, json.length);
            line[json.length] = '\n';
            return line;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode " + command.getClass().getSimpleName(), e);
        }
    }

    private ObjectNode toFrame(OutboundCommand command) {
        ObjectNode frame = objectMapper.createObjectNode();
        if (command instanceof OutboundCommand.Prompt prompt) {
            frame.put("type", "user");
            ObjectNode message = frame.putObject("message");
            message.put("role", "user");
            message.put("content", prompt.text());
            frame.putNull("parent_tool_use_id");
            frame.put("session_id", prompt.conversationId() != null ? prompt.conversationId() : "default");
        } else if (command instanceof OutboundCommand.Init init) {
            ObjectNode request = controlRequest(frame, init.requestId(), ControlRequest.INITIALIZE);
            init.options().forEach((key, value) -> request.set(key, objectMapper.valueToTree(value)));
        } else if (command instanceof OutboundCommand.Interrupt interrupt) {
            controlRequest(frame, interrupt.requestId(), ControlRequest.INTERRUPT);
        } else if (command instanceof OutboundCommand.ControlReply reply) {
            frame.put("type", "control_response");
            ObjectNode response = frame.putObject("response");
            response.put("subtype", reply.success() ? "success" : "error");
            response.put("request_id", reply.requestId());
            if (reply.success()) {
                response.set("response", objectMapper.valueToTree(reply.payload()));
            } else {
                response.put("error", reply.error());
            }
        } else {
            throw new IllegalArgumentException("Unsupported command: " + command);
        }
        return frame;
    }

    private ObjectNode controlRequest(ObjectNode frame, String requestId, String subtype) {
        frame.put("type", "control_request");
        frame.put("request_id", requestId);
        ObjectNode request = frame.putObject("request");
        request.put("subtype", subtype);
        return request;
    }

    // -- Decoding ------------------------------------------------------------

    /**
     * Creates a decoder that keeps framing state for one byte stream.
     */
    public FrameDecoder newDecoder(int maxFrameBytes) {
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive");
        }
        return new FrameDecoder(this, maxFrameBytes);
    }

    /**
     * Lazily decodes a stream. Each {@code hasNext()} reads only as much input as it needs
     * to complete the next frame; I/O failures surface as {@link UncheckedIOException}.
     */
    public Iterator<DecodedFrame> decode(InputStream in, int maxFrameBytes) {
        return new FrameIterator(in, newDecoder(maxFrameBytes));
    }

    /**
     * Decodes a single frame without its line terminator.
     *
     * @throws ProtocolDecodeException if the frame is not a JSON object with a string {@code type}
     *                                 or a required field of its variant is missing
     */
    public ProtocolMessage decodeFrame(String line) {
        JsonNode root;
        try {
            root = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new ProtocolDecodeException("Malformed JSON frame: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolDecodeException("Frame is not a JSON object");
        }
        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new ProtocolDecodeException("Frame has no 'type' field");
        }

        String type = typeNode.asText();
        return switch (type) {
            case "assistant" -> decodeAssistant(root);
            case "user" -> decodeUser(root);
            case "system" -> new LifecycleEvent(LifecycleEvent.Kind.SYSTEM, text(root, "subtype"),
                    false, null, null, toMap(root));
            case "result" -> decodeResult(root);
            case "stream_event" -> new LifecycleEvent(LifecycleEvent.Kind.STREAM, text(root.path("event"), "type"),
                    false, null, null, toMap(root.path("event")));
            case "error" -> new LifecycleEvent(LifecycleEvent.Kind.ERROR, text(root, "subtype"),
                    true, null, firstText(root, "message", "error"), toMap(root));
            case "control_request" -> decodeControlRequest(root);
            case "control_response" -> decodeControlResponse(root);
            default -> new UnknownFrame(type, toMap(root));
        };
    }

    private ProtocolMessage decodeAssistant(JsonNode root) {
        JsonNode message = requireObject(root, "message", "assistant");
        List<ContentBlock> content = decodeContent(message.get("content"));
        String model = text(message, "model");

        List<ContentBlock.ToolUseBlock> toolUses = new ArrayList<>();
        for (ContentBlock block : content) {
            if (block instanceof ContentBlock.ToolUseBlock toolUse) {
                toolUses.add(toolUse);
            }
        }
        if (!toolUses.isEmpty()) {
            return new ToolInvocation(model, toolUses, content);
        }
        return new AssistantOutput(model, content);
    }

    private ProtocolMessage decodeUser(JsonNode root) {
        JsonNode message = requireObject(root, "message", "user");
        List<ContentBlock> content = decodeContent(message.get("content"));

        List<ContentBlock.ToolResultBlock> results = new ArrayList<>();
        for (ContentBlock block : content) {
            if (block instanceof ContentBlock.ToolResultBlock result) {
                results.add(result);
            }
        }
        if (!results.isEmpty()) {
            return new ToolResult(results);
        }
        return new UserEcho(content);
    }

    private ProtocolMessage decodeResult(JsonNode root) {
        JsonNode turns = root.get("num_turns");
        Integer numTurns = turns != null && turns.canConvertToInt() ? turns.asInt() : null;
        return new LifecycleEvent(LifecycleEvent.Kind.RESULT, text(root, "subtype"),
                root.path("is_error").asBoolean(false), numTurns, text(root, "result"), toMap(root));
    }

    private ProtocolMessage decodeControlRequest(JsonNode root) {
        String requestId = text(root, "request_id");
        if (requestId == null) {
            throw new ProtocolDecodeException("control_request frame has no 'request_id'");
        }
        JsonNode request = requireObject(root, "request", "control_request");
        return new ControlRequest(requestId, text(request, "subtype"), text(request, "tool_name"),
                toMap(request.path("input")), toMap(request));
    }

    private ProtocolMessage decodeControlResponse(JsonNode root) {
        JsonNode response = requireObject(root, "response", "control_response");
        return new ControlResponse(text(response, "request_id"), text(response, "subtype"),
                toMap(response.path("response")), text(response, "error"));
    }

    private List<ContentBlock> decodeContent(JsonNode content) {
        if (content == null || content.isNull()) {
            return List.of();
        }
        if (content.isTextual()) {
            return List.of(new ContentBlock.TextBlock(content.asText()));
        }
        if (!content.isArray()) {
            throw new ProtocolDecodeException("Message content must be a string or an array");
        }
        List<ContentBlock> blocks = new ArrayList<>(content.size());
        for (JsonNode block : content) {
            blocks.add(decodeBlock(block));
        }
        return blocks;
    }

    private ContentBlock decodeBlock(JsonNode block) {
        String blockType = text(block, "type");
        if (blockType == null) {
            return new ContentBlock.OtherBlock(null, toMap(block));
        }
        return switch (blockType) {
            case "text" -> new ContentBlock.TextBlock(block.path("text").asText(""));
            case "thinking" -> new ContentBlock.ThinkingBlock(block.path("thinking").asText(""),
                    text(block, "signature"));
            case "tool_use" -> new ContentBlock.ToolUseBlock(text(block, "id"), text(block, "name"),
                    toMap(block.path("input")));
            case "tool_result" -> decodeToolResult(block);
            default -> new ContentBlock.OtherBlock(blockType, toMap(block));
        };
    }

    private ContentBlock decodeToolResult(JsonNode block) {
        JsonNode result = block.get("content");
        Object value = result == null || result.isNull() ? null : objectMapper.convertValue(result, Object.class);
        return new ContentBlock.ToolResultBlock(text(block, "tool_use_id"), value,
                block.path("is_error").asBoolean(false));
    }

    private static JsonNode requireObject(JsonNode root, String field, String frameType) {
        JsonNode node = root.get(field);
        if (node == null || !node.isObject()) {
            throw new ProtocolDecodeException(frameType + " frame has no '" + field + "' object");
        }
        return node;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(objectMapper.convertValue(node, MAP_TYPE));
    }

    /**
     * Pull-based view over a stream; reads a chunk only when no decoded frame is queued.
     */
    private static final class FrameIterator implements Iterator<DecodedFrame> {

        private final InputStream in;
        private final FrameDecoder decoder;
        private final Deque<DecodedFrame> ready = new ArrayDeque<>();
        private final byte[] chunk = new byte[READ_CHUNK];
        private boolean eof;

        FrameIterator(InputStream in, FrameDecoder decoder) {
            this.in = in;
            this.decoder = decoder;
        }

        @Override
        public boolean hasNext() {
            while (ready.isEmpty() && !eof) {
                int n;
                try {
                    n = in.read(chunk);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                if (n < 0) {
                    eof = true;
                    ready.addAll(decoder.finish());
                } else {
                    ready.addAll(decoder.feed(chunk, 0, n));
                }
            }
            return !ready.isEmpty();
        }

        @Override
        public DecodedFrame next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return ready.poll();
        }
    }
}
