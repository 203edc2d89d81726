package com.agentmux.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the agent treats tool permission prompts. Values match the CLI's {@code --permission-mode}.
 */
public enum PermissionMode {
    DEFAULT("default"),
    ACCEPT_EDITS("acceptEdits"),
    PLAN("plan"),
    BYPASS_PERMISSIONS("bypassPermissions");

    private final String cliValue;

    PermissionMode(String cliValue) {
        this.cliValue = cliValue;
    }

    @JsonValue
    public String cliValue() {
        return cliValue;
    }

    @JsonCreator
    public static PermissionMode fromValue(String value) {
        for (PermissionMode mode : values()) {
            if (mode.cliValue.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown permission mode: " + value);
    }
}
