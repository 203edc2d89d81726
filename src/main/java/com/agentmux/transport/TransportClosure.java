package com.agentmux.transport;

import com.agentmux.core.error.AgentmuxException;

import java.util.List;

/**
 * How a transport's output stream ended.
 *
 * @param exitCode   process exit status, null if it could not be determined
 * @param cause      the transport failure that ended the stream, null for a normal end of output
 * @param stderrTail the last lines the process wrote to stderr
 */
public record TransportClosure(Integer exitCode, AgentmuxException cause, List<String> stderrTail) {

    public TransportClosure {
        stderrTail = List.copyOf(stderrTail);
    }

    public boolean isCleanExit() {
        return cause == null && exitCode != null && exitCode == 0;
    }
}
