package com.agentmux.core.security;

import com.agentmux.core.error.SpawnFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Builds the environment an agent subprocess starts with.
 * <p>
 * Inherited variables pass only if allowlisted and not denied; denied ones are dropped
 * silently. Overrides from a spawn request are rejected outright if they name a denied or
 * protected variable, so the caller learns about it before any process exists.
 */
@Service
public class EnvironmentPolicy {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentPolicy.class);

    public static final String ENTRYPOINT_VARIABLE = "CLAUDE_CODE_ENTRYPOINT";
    public static final String ENTRYPOINT_VALUE = "sdk-java";

    private static final Pattern VARIABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final SecurityProperties securityProperties;

    public EnvironmentPolicy(SecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
    }

    /**
     * @param inherited        the orchestrator's environment
     * @param overrides        variables requested by the caller
     * @param workingDirectory the agent's working directory, exported as {@code PWD} when set
     * @return the complete child environment
     * @throws SpawnFailedException if an override is malformed or not permitted
     */
    public Map<String, String> buildEnvironment(Map<String, String> inherited,
                                                Map<String, String> overrides,
                                                String workingDirectory) {
        Map<String, String> env = new TreeMap<>();
        int dropped = 0;
        for (var entry : inherited.entrySet()) {
            if (isInheritable(entry.getKey())) {
                env.put(entry.getKey(), entry.getValue());
            } else {
                dropped++;
            }
        }
        if (dropped > 0) {
            log.debug("Dropped {} inherited environment variables not on the allowlist", dropped);
        }

        for (var entry : overrides.entrySet()) {
            String name = entry.getKey();
            String value = entry.getValue();
            if (name == null || !VARIABLE_NAME.matcher(name).matches()) {
                throw new SpawnFailedException("Invalid environment variable name: " + name);
            }
            if (!isOverrideAllowed(name)) {
                throw new SpawnFailedException("Environment override not permitted: " + name);
            }
            if (value == null || value.indexOf('\0') >= 0) {
                throw new SpawnFailedException("Invalid value for environment variable " + name);
            }
            env.put(name, value);
        }

        env.put(ENTRYPOINT_VARIABLE, ENTRYPOINT_VALUE);
        if (workingDirectory != null) {
            env.put("PWD", workingDirectory);
        }
        return env;
    }

    public boolean isInheritable(String name) {
        return AllowlistMatcher.matchesAny(securityProperties.getInheritedEnvAllowlist(), name)
                && !AllowlistMatcher.matchesAny(securityProperties.getDeniedEnv(), name);
    }

    public boolean isOverrideAllowed(String name) {
        return !AllowlistMatcher.matchesAny(securityProperties.getDeniedEnv(), name)
                && !AllowlistMatcher.matchesAny(securityProperties.getProtectedOverrideEnv(), name);
    }
}
