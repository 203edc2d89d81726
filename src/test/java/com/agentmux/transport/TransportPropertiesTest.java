package com.agentmux.transport;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class TransportPropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new TransportProperties();
        assertEquals("claude", props.getExecutable());
        assertEquals(30, props.getIoTimeoutSeconds());
        assertEquals(30, props.getReadIdleTimeoutSeconds());
        assertEquals(5, props.getGraceSeconds());
        assertEquals(1024 * 1024, props.getMaxFrameBytes());
        assertEquals(64, props.getWriteQueueCapacity());
        assertEquals(20, props.getStderrTailLines());
    }
}
