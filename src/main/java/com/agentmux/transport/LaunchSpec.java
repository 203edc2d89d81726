package com.agentmux.transport;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Fully validated description of a subprocess to start.
 *
 * @param command          executable followed by its arguments
 * @param environment      the complete child environment; nothing else is inherited
 * @param workingDirectory directory to start in, or null for the orchestrator's own
 */
public record LaunchSpec(List<String> command, Map<String, String> environment, Path workingDirectory) {

    public LaunchSpec {
        command = List.copyOf(command);
        environment = Map.copyOf(environment);
    }

    public String executable() {
        return command.get(0);
    }
}
