package com.agentmux.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for session orchestration.
 */
@Service
public class AgentmuxMetrics {

    private final MeterRegistry registry;

    public AgentmuxMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSpawn(boolean success) {
        Counter.builder("agentmux.sessions.spawned")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordCapacityRejection() {
        Counter.builder("agentmux.sessions.capacity_rejections")
                .register(registry)
                .increment();
    }

    /**
     * Records a session reaching a terminal state.
     *
     * @param state     the terminal state name
     * @param runtimeMs session runtime
     */
    public void recordSessionEnded(String state, long runtimeMs) {
        Timer.builder("agentmux.sessions.runtime")
                .tag("state", state)
                .register(registry)
                .record(Duration.ofMillis(runtimeMs));
    }

    public void recordDecodeError() {
        Counter.builder("agentmux.protocol.decode_errors")
                .description("Inbound frames that could not be decoded")
                .register(registry)
                .increment();
    }

    public void recordWriteTimeout() {
        Counter.builder("agentmux.transport.write_timeouts")
                .register(registry)
                .increment();
    }

    /**
     * Records the verdict given to a control request from an agent.
     *
     * @param subtype control request subtype
     * @param allowed whether the request was allowed
     */
    public void recordControlVerdict(String subtype, boolean allowed) {
        Counter.builder("agentmux.control.verdicts")
                .tag("subtype", subtype == null ? "unknown" : subtype)
                .tag("allowed", String.valueOf(allowed))
                .register(registry)
                .increment();
    }
}
