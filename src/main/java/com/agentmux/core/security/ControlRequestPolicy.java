package com.agentmux.core.security;

import com.agentmux.core.protocol.ControlRequest;

/**
 * Decides control requests raised by agents, such as tool permission checks.
 * Implementations are called from session read loops and must not block.
 */
public interface ControlRequestPolicy {

    /**
     * @param context the requesting session
     * @param request a request that has already passed structural validation
     * @return the verdict; never null
     */
    PolicyVerdict decide(SessionPolicyContext context, ControlRequest request);
}
