package com.agentmux.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing agentmux MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String SESSION_ID = "sessionId";
    public static final String SESSION_LABEL = "sessionLabel";

    private MdcContext() {}

    public static void setSession(String sessionId, String label) {
        MDC.put(SESSION_ID, sessionId);
        if (label != null) {
            MDC.put(SESSION_LABEL, label);
        }
    }

    public static void clear() {
        MDC.remove(SESSION_ID);
        MDC.remove(SESSION_LABEL);
    }
}
