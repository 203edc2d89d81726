package com.agentmux.transport;

import com.agentmux.core.error.ProtocolDecodeException;
import com.agentmux.core.protocol.ProtocolMessage;

/**
 * Receives everything a transport reads, in stream order, on the transport's read-loop thread.
 */
public interface TransportListener {

    void onFrame(ProtocolMessage message, int sizeBytes);

    void onDecodeError(ProtocolDecodeException error);

    /** Called exactly once, after the last frame, when the output stream has ended. */
    void onClosed(TransportClosure closure);
}
