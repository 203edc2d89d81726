package com.agentmux.core.error;

/**
 * Closed set of failure kinds surfaced to callers of the session registry.
 */
public enum ErrorKind {
    SPAWN_FAILED,
    CAPACITY_EXCEEDED,
    SESSION_NOT_FOUND,
    SESSION_NOT_ACTIVE,
    TIMEOUT,
    PROTOCOL_DECODE_ERROR,
    TRANSPORT_IO_ERROR,
    INVALID_REQUEST
}
