package com.agentmux.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Allowlists applied before an agent subprocess is launched. Entries ending in {@code *}
 * match by prefix.
 */
@Component
@ConfigurationProperties(prefix = "agentmux.security")
public class SecurityProperties {

    /** Variables of the orchestrator's own environment passed on to agents. */
    private List<String> inheritedEnvAllowlist = List.of(
            "PATH", "HOME", "USER", "LOGNAME", "SHELL", "LANG", "LC_*", "TERM", "TMPDIR", "TZ",
            "XDG_*", "ANTHROPIC_*", "CLAUDE_*");

    /** Variables that can alter how the agent's runtime loads code. Never inherited or overridden. */
    private List<String> deniedEnv = List.of(
            "LD_PRELOAD", "LD_LIBRARY_PATH", "LD_AUDIT", "DYLD_*", "NODE_OPTIONS", "PYTHONPATH",
            "PYTHONSTARTUP", "PERL5LIB", "PERL5OPT", "RUBYLIB", "RUBYOPT", "JAVA_TOOL_OPTIONS",
            "_JAVA_OPTIONS", "JDK_JAVA_OPTIONS", "BASH_ENV", "ENV");

    /** Variables that may be inherited but not overridden by a spawn request. */
    private List<String> protectedOverrideEnv = List.of("PATH", "HOME", "PWD");

    /** Extra CLI flags (without leading dashes) a spawn request may pass. */
    private List<String> allowedExtraFlags = List.of("timeout", "retries", "log-level", "cache-dir");

    public List<String> getInheritedEnvAllowlist() {
        return inheritedEnvAllowlist;
    }

    public void setInheritedEnvAllowlist(List<String> inheritedEnvAllowlist) {
        this.inheritedEnvAllowlist = inheritedEnvAllowlist;
    }

    public List<String> getDeniedEnv() {
        return deniedEnv;
    }

    public void setDeniedEnv(List<String> deniedEnv) {
        this.deniedEnv = deniedEnv;
    }

    public List<String> getProtectedOverrideEnv() {
        return protectedOverrideEnv;
    }

    public void setProtectedOverrideEnv(List<String> protectedOverrideEnv) {
        this.protectedOverrideEnv = protectedOverrideEnv;
    }

    public List<String> getAllowedExtraFlags() {
        return allowedExtraFlags;
    }

    public void setAllowedExtraFlags(List<String> allowedExtraFlags) {
        this.allowedExtraFlags = allowedExtraFlags;
    }
}
