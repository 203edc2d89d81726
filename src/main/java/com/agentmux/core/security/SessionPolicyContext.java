package com.agentmux.core.security;

import com.agentmux.core.model.PermissionMode;

import java.util.List;

/**
 * What a {@link ControlRequestPolicy} knows about the session asking.
 */
public record SessionPolicyContext(
        String sessionId,
        String label,
        List<String> allowedTools,
        List<String> disallowedTools,
        PermissionMode permissionMode
) {}
