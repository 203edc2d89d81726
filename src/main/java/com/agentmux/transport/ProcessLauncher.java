package com.agentmux.transport;

import java.io.IOException;

/**
 * Starts agent subprocesses. All three standard streams of the returned process must be pipes.
 */
public interface ProcessLauncher {

    /**
     * Start a process.
     *
     * @param spec what to run
     * @return the running process
     * @throws IOException if the executable cannot be started
     */
    Process launch(LaunchSpec spec) throws IOException;
}
