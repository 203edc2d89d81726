package com.agentmux.core.protocol;

import java.util.List;

/**
 * A user turn echoed back by the agent.
 */
public record UserEcho(List<ContentBlock> content) implements ProtocolMessage {

    public UserEcho {
        content = List.copyOf(content);
    }
}
