package com.agentmux.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Launches agents as local child processes via {@link ProcessBuilder}.
 */
public class LocalProcessLauncher implements ProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessLauncher.class);

    @Override
    public Process launch(LaunchSpec spec) throws IOException {
        var builder = new ProcessBuilder(spec.command());
        var env = builder.environment();
        env.clear();
        env.putAll(spec.environment());
        if (spec.workingDirectory() != null) {
            builder.directory(spec.workingDirectory().toFile());
        }
        log.debug("Starting {} with {} arguments in {}", spec.executable(), spec.command().size() - 1,
                spec.workingDirectory() != null ? spec.workingDirectory() : "current directory");
        return builder.start();
    }
}
