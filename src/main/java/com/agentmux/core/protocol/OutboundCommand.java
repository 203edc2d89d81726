package com.agentmux.core.protocol;

import java.util.Map;

/**
 * Commands the orchestrator writes to an agent's stdin.
 */
public sealed interface OutboundCommand {

    /** Opens the control channel. {@code options} is merged into the request body. */
    record Init(String requestId, Map<String, Object> options) implements OutboundCommand {
        public Init {
            options = options == null ? Map.of() : Map.copyOf(options);
        }
    }

    /** A user turn. */
    record Prompt(String text, String conversationId) implements OutboundCommand {}

    /** Asks the agent to stop the turn in progress. */
    record Interrupt(String requestId) implements OutboundCommand {}

    /** Answer to a {@link ControlRequest} from the agent. */
    record ControlReply(
            String requestId,
            boolean success,
            Map<String, Object> payload,
            String error
    ) implements OutboundCommand {

        public static ControlReply success(String requestId, Map<String, Object> payload) {
            return new ControlReply(requestId, true, payload == null ? Map.of() : payload, null);
        }

        public static ControlReply error(String requestId, String error) {
            return new ControlReply(requestId, false, Map.of(), error);
        }
    }
}
