package com.agentmux.core.protocol;

import java.util.Map;

/**
 * A well-formed frame whose {@code type} is not modelled.
 */
public record UnknownFrame(String type, Map<String, Object> raw) implements ProtocolMessage {}
