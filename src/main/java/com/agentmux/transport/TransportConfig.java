package com.agentmux.transport;

import com.agentmux.core.protocol.ControlProtocolCodec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class TransportConfig {

    public static final String IO_EXECUTOR = "transportIoExecutor";
    public static final String WATCHDOG_SCHEDULER = "transportWatchdogScheduler";

    @Bean
    @ConditionalOnMissingBean
    public ProcessLauncher processLauncher() {
        return new LocalProcessLauncher();
    }

    @Bean
    public ControlProtocolCodec controlProtocolCodec() {
        return new ControlProtocolCodec();
    }

    /**
     * Runs launches, read loops and stderr drains. Each live session holds two threads.
     */
    @Bean(name = IO_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService transportIoExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("agentmux-io-"));
    }

    @Bean(name = WATCHDOG_SCHEDULER, destroyMethod = "shutdownNow")
    public ScheduledExecutorService transportWatchdogScheduler() {
        return Executors.newSingleThreadScheduledExecutor(daemonThreads("agentmux-watchdog-"));
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
