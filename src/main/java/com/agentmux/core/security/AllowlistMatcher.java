package com.agentmux.core.security;

import java.util.Collection;

/**
 * Exact or trailing-wildcard matching shared by the allowlist policies.
 */
final class AllowlistMatcher {

    private AllowlistMatcher() {}

    static boolean matchesAny(Collection<String> patterns, String value) {
        if (patterns == null || value == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (matches(pattern, value)) {
                return true;
            }
        }
        return false;
    }

    static boolean matches(String pattern, String value) {
        if (pattern.endsWith("*")) {
            String prefix = pattern.substring(0, pattern.length() - 1);
            return value.startsWith(prefix);
        }
        return pattern.equals(value);
    }
}
