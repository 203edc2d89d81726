package com.agentmux.core.security;

import com.agentmux.core.error.SpawnFailedException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Validates the free-form extra flags of a spawn request against the configured allowlist
 * and renders them as CLI arguments.
 */
@Service
public class ArgumentPolicy {

    private final SecurityProperties securityProperties;

    public ArgumentPolicy(SecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
    }

    public boolean isFlagAllowed(String flag) {
        return AllowlistMatcher.matchesAny(securityProperties.getAllowedExtraFlags(), flag);
    }

    /**
     * @param extraArgs flag name (leading dashes optional) to value; a null or blank value emits the flag alone
     * @return arguments in flag-name order, e.g. {@code --timeout 30}
     * @throws SpawnFailedException if a flag is not allowlisted, or a value starts with {@code -}
     *                              or contains control characters
     */
    public List<String> toArguments(Map<String, String> extraArgs) {
        List<String> args = new ArrayList<>();
        for (String name : extraArgs.keySet()) {
            if (name == null) {
                throw new SpawnFailedException("Extra argument without a flag name");
            }
        }
        for (var entry : new TreeMap<>(extraArgs).entrySet()) {
            String flag = stripDashes(entry.getKey());
            if (flag.isEmpty() || !isFlagAllowed(flag)) {
                throw new SpawnFailedException("Extra argument not allowed: --" + flag);
            }
            String value = entry.getValue();
            args.add("--" + flag);
            if (value != null && !value.isBlank()) {
                if (hasControlCharacters(value)) {
                    throw new SpawnFailedException("Invalid value for --" + flag);
                }
                // Passed as its own argv token, so it must not parse as a flag
                if (value.startsWith("-")) {
                    throw new SpawnFailedException("Value for --" + flag + " must not start with '-'");
                }
                args.add(value);
            }
        }
        return args;
    }

    private static String stripDashes(String flag) {
        int i = 0;
        while (i < flag.length() && flag.charAt(i) == '-') {
            i++;
        }
        return flag.substring(i);
    }

    private static boolean hasControlCharacters(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isISOControl(value.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
