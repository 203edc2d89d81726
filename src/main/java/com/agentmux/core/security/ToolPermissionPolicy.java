package com.agentmux.core.security;

import com.agentmux.core.model.PermissionMode;
import com.agentmux.core.protocol.ControlRequest;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default policy: answers tool permission checks from the session's allowed and
 * disallowed tool lists, lets hook callbacks continue, and acknowledges anything else.
 */
@Component
public class ToolPermissionPolicy implements ControlRequestPolicy {

    @Override
    public PolicyVerdict decide(SessionPolicyContext context, ControlRequest request) {
        if (ControlRequest.CAN_USE_TOOL.equals(request.subtype())) {
            return decideToolUse(context, request);
        }
        if (ControlRequest.HOOK_CALLBACK.equals(request.subtype())) {
            return PolicyVerdict.allow(Map.of("continue", true));
        }
        return PolicyVerdict.allow(Map.of());
    }

    private PolicyVerdict decideToolUse(SessionPolicyContext context, ControlRequest request) {
        String tool = request.toolName();
        if (tool == null || tool.isBlank()) {
            return denied("Permission request does not name a tool");
        }
        if (AllowlistMatcher.matchesAny(context.disallowedTools(), tool)) {
            return denied("Tool " + tool + " is disallowed for this session");
        }
        boolean allowed = context.permissionMode() == PermissionMode.BYPASS_PERMISSIONS
                || context.allowedTools().isEmpty()
                || AllowlistMatcher.matchesAny(context.allowedTools(), tool);
        if (!allowed) {
            return denied("Tool " + tool + " is not in the allowed tools for this session");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("behavior", "allow");
        payload.put("updatedInput", request.input());
        return PolicyVerdict.allow(payload);
    }

    private static PolicyVerdict denied(String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("behavior", "deny");
        payload.put("message", message);
        return PolicyVerdict.deny(message, payload);
    }
}
