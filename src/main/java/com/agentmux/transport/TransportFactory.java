package com.agentmux.transport;

import com.agentmux.core.error.SpawnFailedException;
import com.agentmux.core.model.SpawnOptions;
import com.agentmux.core.protocol.ControlProtocolCodec;
import com.agentmux.core.security.ArgumentPolicy;
import com.agentmux.core.security.EnvironmentPolicy;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

/**
 * Turns spawn options into launchable transports. All validation happens in
 * {@link #prepare}, before any process exists.
 */
@Component
public class TransportFactory {

    private final TransportProperties properties;
    private final ProcessLauncher launcher;
    private final ControlProtocolCodec codec;
    private final CommandBuilder commandBuilder;
    private final EnvironmentPolicy environmentPolicy;
    private final ArgumentPolicy argumentPolicy;
    private final ExecutorService ioExecutor;
    private final ScheduledExecutorService scheduler;
    private final Supplier<Map<String, String>> inheritedEnvironment;

    @Autowired
    public TransportFactory(TransportProperties properties,
                            ProcessLauncher launcher,
                            ControlProtocolCodec codec,
                            CommandBuilder commandBuilder,
                            EnvironmentPolicy environmentPolicy,
                            ArgumentPolicy argumentPolicy,
                            @Qualifier(TransportConfig.IO_EXECUTOR) ExecutorService ioExecutor,
                            @Qualifier(TransportConfig.WATCHDOG_SCHEDULER) ScheduledExecutorService scheduler) {
        this(properties, launcher, codec, commandBuilder, environmentPolicy, argumentPolicy,
                ioExecutor, scheduler, System::getenv);
    }

    TransportFactory(TransportProperties properties,
                     ProcessLauncher launcher,
                     ControlProtocolCodec codec,
                     CommandBuilder commandBuilder,
                     EnvironmentPolicy environmentPolicy,
                     ArgumentPolicy argumentPolicy,
                     ExecutorService ioExecutor,
                     ScheduledExecutorService scheduler,
                     Supplier<Map<String, String>> inheritedEnvironment) {
        this.properties = properties;
        this.launcher = launcher;
        this.codec = codec;
        this.commandBuilder = commandBuilder;
        this.environmentPolicy = environmentPolicy;
        this.argumentPolicy = argumentPolicy;
        this.ioExecutor = ioExecutor;
        this.scheduler = scheduler;
        this.inheritedEnvironment = inheritedEnvironment;
    }

    /**
     * Validates options and resolves the exact command, environment and directory to launch.
     *
     * @throws SpawnFailedException if an extra argument, environment override or directory is rejected
     */
    public LaunchSpec prepare(SpawnOptions options, int maxTurns) {
        List<String> extraArgs = argumentPolicy.toArguments(options.extraArgs());
        Path workingDirectory = resolveDirectory(options.workingDirectory(), "Working directory");
        for (String dir : options.addDirs()) {
            resolveDirectory(dir, "Additional directory");
        }
        Map<String, String> environment = environmentPolicy.buildEnvironment(
                inheritedEnvironment.get(), options.env(),
                workingDirectory != null ? workingDirectory.toString() : null);
        List<String> command = commandBuilder.build(properties.getExecutable(), options, maxTurns, extraArgs);
        return new LaunchSpec(command, environment, workingDirectory);
    }

    /**
     * Creates an unstarted transport for one session.
     */
    public SubprocessTransport create(String sessionId, String label, LaunchSpec spec) {
        return new SubprocessTransport(sessionId, label, spec, launcher, codec, properties, ioExecutor, scheduler);
    }

    private static Path resolveDirectory(String dir, String what) {
        if (dir == null) {
            return null;
        }
        try {
            Path path = Path.of(dir).toAbsolutePath().normalize();
            if (!Files.isDirectory(path)) {
                throw new SpawnFailedException(what + " does not exist: " + dir);
            }
            return path;
        } catch (InvalidPathException e) {
            throw new SpawnFailedException(what + " is not a valid path: " + dir, e);
        }
    }
}
