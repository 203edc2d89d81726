package com.agentmux.transport;

import com.agentmux.core.error.AgentmuxException;
import com.agentmux.core.error.SpawnFailedException;
import com.agentmux.core.error.TransportIoException;
import com.agentmux.core.error.TransportTimeoutException;
import com.agentmux.core.logging.MdcContext;
import com.agentmux.core.protocol.ControlProtocolCodec;
import com.agentmux.core.protocol.DecodedFrame;
import com.agentmux.core.protocol.LifecycleEvent;
import com.agentmux.core.protocol.OutboundCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns one agent subprocess and its three pipes.
 * <p>
 * Inbound: a read loop on the shared I/O executor decodes stdout frame by frame and hands each
 * frame to the {@link TransportListener}; a second task drains stderr. Outbound: commands are
 * encoded to complete frames and written by a dedicated single-thread writer with a bounded
 * queue, so frames are never interleaved and every write is bounded by the I/O timeout.
 * <p>
 * A write that times out, or a turn that produces no output for longer than the idle timeout,
 * tears the process down: once a frame may be half-written nothing else is sent on the pipe.
 * Every exit path ends with the process reaped (force-killed if needed) and the listener's
 * {@link TransportListener#onClosed} invoked once.
 */
public class SubprocessTransport {

    private static final Logger log = LoggerFactory.getLogger(SubprocessTransport.class);

    static final int MAX_STDERR_LINE_BYTES = 500;
    private static final int STDERR_CHUNK_BYTES = 8192;

    private final String sessionId;
    private final String label;
    private final LaunchSpec launchSpec;
    private final ProcessLauncher launcher;
    private final ControlProtocolCodec codec;
    private final TransportProperties properties;
    private final ExecutorService ioExecutor;
    private final ScheduledExecutorService scheduler;
    private final ThreadPoolExecutor writer;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicBoolean terminateCalled = new AtomicBoolean();
    private final AtomicBoolean inputEnded = new AtomicBoolean();
    private final AtomicReference<AgentmuxException> failure = new AtomicReference<>();
    private final AtomicLong requestCounter = new AtomicLong();
    private final Deque<String> stderrTail = new ArrayDeque<>();
    private final CountDownLatch stderrDrained = new CountDownLatch(1);
    private final CountDownLatch closedSignal = new CountDownLatch(1);
    private final CountDownLatch terminationDone = new CountDownLatch(1);

    private volatile Process process;
    private volatile OutputStream stdin;
    private volatile long lastReadNanos;
    private volatile boolean turnInFlight;
    private volatile boolean writing;
    private volatile ScheduledFuture<?> watchdog;

    public SubprocessTransport(String sessionId,
                               String label,
                               LaunchSpec launchSpec,
                               ProcessLauncher launcher,
                               ControlProtocolCodec codec,
                               TransportProperties properties,
                               ExecutorService ioExecutor,
                               ScheduledExecutorService scheduler) {
        this.sessionId = sessionId;
        this.label = label;
        this.launchSpec = launchSpec;
        this.launcher = launcher;
        this.codec = codec;
        this.properties = properties;
        this.ioExecutor = ioExecutor;
        this.scheduler = scheduler;
        this.writer = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, properties.getWriteQueueCapacity())),
                r -> {
                    Thread t = new Thread(r, "agentmux-writer-" + shortId(sessionId));
                    t.setDaemon(true);
                    return t;
                });
    }

    // -- Lifecycle ------------------------------------------------------------

    /**
     * Launches the process and starts reading. Returns as soon as the process is running.
     *
     * @throws SpawnFailedException       if the executable cannot be started
     * @throws TransportTimeoutException  if the launch does not finish within the I/O timeout
     */
    public void start(TransportListener listener) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Transport for session " + sessionId + " already started");
        }
        if (terminateCalled.get()) {
            throw new TransportIoException("Transport for session " + sessionId + " was terminated before start");
        }

        Process launched;
        try {
            launched = launch();
        } catch (RuntimeException e) {
            closed.set(true);
            writer.shutdownNow();
            throw e;
        }
        this.process = launched;
        this.stdin = launched.getOutputStream();
        this.lastReadNanos = System.nanoTime();
        log.info("Launched agent process for session {} ({})", sessionId, launchSpec.executable());

        ioExecutor.execute(() -> readLoop(launched, listener));
        ioExecutor.execute(() -> drainStderr(launched));

        int idleSeconds = properties.getReadIdleTimeoutSeconds();
        if (idleSeconds > 0) {
            long periodMs = Math.max(100L, idleSeconds * 1000L / 4);
            watchdog = scheduler.scheduleAtFixedRate(this::checkIdle, periodMs, periodMs, TimeUnit.MILLISECONDS);
        }

        if (terminateCalled.get()) {
            // terminated while launching
            launched.destroyForcibly();
            releaseResources();
        }
    }

    private Process launch() {
        CompletableFuture<Process> pending = CompletableFuture.supplyAsync(() -> {
            try {
                return launcher.launch(launchSpec);
            } catch (IOException e) {
                throw new CompletionException(e);
            }
        }, ioExecutor);

        int timeout = properties.getIoTimeoutSeconds();
        try {
            return pending.get(timeout, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            pending.thenAccept(this::reapAbandoned);
            throw new TransportTimeoutException(
                    "Launching " + launchSpec.executable() + " did not complete within " + timeout + "s");
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e.getCause());
            throw new SpawnFailedException(
                    "Failed to launch " + launchSpec.executable() + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.thenAccept(this::reapAbandoned);
            throw new SpawnFailedException("Interrupted while launching " + launchSpec.executable(), e);
        }
    }

    private void reapAbandoned(Process late) {
        log.warn("Destroying process for session {} that finished launching after its timeout", sessionId);
        late.destroyForcibly();
    }

    /**
     * Stops the process. Graceful termination sends an interrupt, closes stdin and waits up to
     * the grace window before force-killing. Idempotent: a concurrent or later call waits for the
     * first one to finish and then returns.
     */
    public void terminate(boolean graceful) {
        if (!terminateCalled.compareAndSet(false, true)) {
            awaitTermination();
            return;
        }
        closed.set(true);
        Process proc = process;
        if (proc == null) {
            writer.shutdownNow();
            terminationDone.countDown();
            return;
        }

        int grace = properties.getGraceSeconds();
        try {
            if (graceful && proc.isAlive()) {
                requestExit();
                if (!proc.waitFor(grace, TimeUnit.SECONDS)) {
                    log.warn("Session {} did not exit within {}s of interrupt; killing", sessionId, grace);
                }
            }
            if (proc.isAlive()) {
                proc.destroyForcibly();
                if (!proc.waitFor(grace, TimeUnit.SECONDS)) {
                    log.error("Session {} process still alive {}s after kill", sessionId, grace);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            proc.destroyForcibly();
        } finally {
            releaseResources();
            terminationDone.countDown();
        }
        log.info("Transport for session {} terminated ({})", sessionId, graceful ? "graceful" : "forced");
    }

    private void awaitTermination() {
        long bound = 3L * properties.getGraceSeconds() + 1;
        try {
            if (!terminationDone.await(bound, TimeUnit.SECONDS)) {
                log.warn("Termination of session {} still in progress after {}s", sessionId, bound);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Writes an interrupt and closes stdin through the writer, unless a write is stuck,
     * in which case the caller goes straight to killing.
     */
    private void requestExit() {
        if (writing || !writer.getQueue().isEmpty() || inputEnded.get()) {
            return;
        }
        byte[] interrupt = codec.encode(new OutboundCommand.Interrupt(nextRequestId()));
        try {
            Future<?> done = writer.submit(() -> {
                try {
                    writeFrame(interrupt, false);
                } catch (UncheckedIOException e) {
                    log.debug("Interrupt not delivered to session {}: {}", sessionId, e.getMessage());
                }
                closeQuietly(stdin);
            });
            done.get(properties.getGraceSeconds(), TimeUnit.SECONDS);
        } catch (RejectedExecutionException | ExecutionException | TimeoutException e) {
            log.debug("Could not request graceful exit of session {}: {}", sessionId, e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Closes stdin after all queued writes. The agent exits once it has consumed its input.
     */
    public void endInput() {
        if (closed.get() || !inputEnded.compareAndSet(false, true)) {
            return;
        }
        try {
            writer.execute(() -> closeQuietly(stdin));
            log.debug("Input ended for session {}", sessionId);
        } catch (RejectedExecutionException e) {
            log.debug("Writer for session {} already stopped: {}", sessionId, e.getMessage());
        }
    }

    // -- Writing --------------------------------------------------------------

    /**
     * Queues a command. The returned future fails with {@link TransportTimeoutException} if the
     * frame is not written within the I/O timeout, which also tears the transport down.
     */
    public CompletableFuture<Void> submit(OutboundCommand command) {
        if (process == null || closed.get() || inputEnded.get()) {
            return CompletableFuture.failedFuture(
                    new TransportIoException("Transport for session " + sessionId + " is closed"));
        }
        byte[] frame = codec.encode(command);
        boolean prompt = command instanceof OutboundCommand.Prompt;

        CompletableFuture<Void> write;
        try {
            write = CompletableFuture.runAsync(() -> writeFrame(frame, prompt), writer);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new TransportIoException(
                    "Write queue for session " + sessionId + " is full or closed", e));
        }

        return write
                .orTimeout(properties.getIoTimeoutSeconds(), TimeUnit.SECONDS)
                .handle((ignored, error) -> {
                    if (error == null) {
                        return null;
                    }
                    AgentmuxException translated = translate(error);
                    if (translated instanceof TransportTimeoutException timeout) {
                        onWriteTimeout(timeout);
                    }
                    throw translated;
                });
    }

    /**
     * Writes a command and waits until it has been flushed to the process.
     *
     * @throws TransportTimeoutException if the write is not completed within the I/O timeout
     * @throws TransportIoException      if the transport is closed or the pipe fails
     */
    public void write(OutboundCommand command) {
        try {
            submit(command).get();
        } catch (ExecutionException e) {
            AgentmuxException failure = translate(e.getCause());
            if (failure instanceof TransportTimeoutException) {
                // make sure the process is gone before the caller sees the timeout
                terminate(false);
            }
            throw failure;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportIoException("Interrupted while writing to session " + sessionId, e);
        }
    }

    private void writeFrame(byte[] frame, boolean prompt) {
        OutputStream out = stdin;
        writing = true;
        try {
            if (prompt) {
                lastReadNanos = System.nanoTime();
                turnInFlight = true;
            }
            out.write(frame);
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } finally {
            writing = false;
        }
    }

    private void onWriteTimeout(TransportTimeoutException timeout) {
        if (failure.compareAndSet(null, timeout)) {
            log.warn("Write to session {} timed out; tearing down transport", sessionId);
        }
        try {
            ioExecutor.execute(() -> terminate(false));
        } catch (RejectedExecutionException e) {
            terminate(false);
        }
    }

    private AgentmuxException translate(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof AgentmuxException agentmux) {
            return agentmux;
        }
        if (cause instanceof TimeoutException) {
            return new TransportTimeoutException("Write to session " + sessionId
                    + " not completed within " + properties.getIoTimeoutSeconds() + "s");
        }
        if (cause instanceof UncheckedIOException io) {
            return new TransportIoException("Write to session " + sessionId + " failed: "
                    + io.getCause().getMessage(), io.getCause());
        }
        return new TransportIoException("Write to session " + sessionId + " failed: " + cause, cause);
    }

    // -- Reading --------------------------------------------------------------

    private void readLoop(Process proc, TransportListener listener) {
        MdcContext.setSession(sessionId, label);
        AgentmuxException cause = null;
        try {
            Iterator<DecodedFrame> frames = codec.decode(
                    new ActivityTrackingStream(proc.getInputStream()), properties.getMaxFrameBytes());
            while (frames.hasNext()) {
                DecodedFrame frame = frames.next();
                if (frame.isError()) {
                    listener.onDecodeError(frame.error());
                    continue;
                }
                if (frame.message() instanceof LifecycleEvent event && event.isDone()) {
                    turnInFlight = false;
                }
                listener.onFrame(frame.message(), frame.sizeBytes());
            }
        } catch (UncheckedIOException e) {
            if (!closed.get()) {
                cause = new TransportIoException("Reading from session " + sessionId + " failed: "
                        + e.getCause().getMessage(), e.getCause());
            }
        } catch (RuntimeException e) {
            log.error("Read loop for session {} failed", sessionId, e);
            cause = new TransportIoException("Read loop for session " + sessionId + " failed: " + e.getMessage(), e);
        }

        try {
            closed.set(true);
            Integer exitCode = awaitExit(proc);
            awaitStderr();
            releaseResources();
            AgentmuxException recorded = failure.get();
            TransportClosure closure = new TransportClosure(exitCode, recorded != null ? recorded : cause, stderrTail());
            log.debug("Output of session {} ended (exit={}, cause={})", sessionId, exitCode,
                    closure.cause() != null ? closure.cause().getMessage() : "none");
            listener.onClosed(closure);
        } finally {
            closedSignal.countDown();
            MdcContext.clear();
        }
    }

    private Integer awaitExit(Process proc) {
        int grace = properties.getGraceSeconds();
        try {
            if (!proc.waitFor(grace, TimeUnit.SECONDS)) {
                log.warn("Session {} closed its output but did not exit within {}s; killing", sessionId, grace);
                proc.destroyForcibly();
                proc.waitFor(grace, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            proc.destroyForcibly();
        }
        return proc.isAlive() ? null : proc.exitValue();
    }

    /**
     * Reads stderr in fixed-size chunks. At most {@link #MAX_STDERR_LINE_BYTES} of a line are
     * kept; the rest is dropped up to the next newline, so a stream without newlines cannot
     * grow memory.
     */
    private void drainStderr(Process proc) {
        MdcContext.setSession(sessionId, label);
        byte[] chunk = new byte[STDERR_CHUNK_BYTES];
        byte[] line = new byte[MAX_STDERR_LINE_BYTES];
        int lineLength = 0;
        boolean clipped = false;
        try (InputStream err = proc.getErrorStream()) {
            int n;
            while ((n = err.read(chunk)) != -1) {
                for (int i = 0; i < n; i++) {
                    byte b = chunk[i];
                    if (b == '\n') {
                        recordStderr(line, lineLength, clipped);
                        lineLength = 0;
                        clipped = false;
                    } else if (lineLength < line.length) {
                        line[lineLength++] = b;
                    } else {
                        clipped = true;
                    }
                }
            }
            if (lineLength > 0) {
                recordStderr(line, lineLength, clipped);
            }
        } catch (IOException e) {
            log.debug("stderr of session {} closed: {}", sessionId, e.getMessage());
        } finally {
            stderrDrained.countDown();
            MdcContext.clear();
        }
    }

    private void recordStderr(byte[] bytes, int length, boolean clipped) {
        if (length > 0 && bytes[length - 1] == '\r') {
            length--;
        }
        String line = new String(bytes, 0, length, StandardCharsets.UTF_8);
        if (clipped) {
            log.debug("stderr (clipped): {}", line);
        } else {
            log.debug("stderr: {}", line);
        }
        int limit = Math.max(1, properties.getStderrTailLines());
        synchronized (stderrTail) {
            while (stderrTail.size() >= limit) {
                stderrTail.removeFirst();
            }
            stderrTail.addLast(line);
        }
    }

    private void awaitStderr() {
        try {
            if (!stderrDrained.await(1, TimeUnit.SECONDS)) {
                log.debug("stderr of session {} still open after exit", sessionId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void checkIdle() {
        if (closed.get() || !turnInFlight) {
            return;
        }
        long timeoutMs = properties.getReadIdleTimeoutSeconds() * 1000L;
        long idleMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - lastReadNanos);
        if (idleMs > timeoutMs) {
            TransportTimeoutException timeout = new TransportTimeoutException(
                    "No output from session " + sessionId + " for " + idleMs + "ms while a turn was in progress");
            if (failure.compareAndSet(null, timeout)) {
                log.warn("{}; tearing down transport", timeout.getMessage());
            }
            terminate(false);
        }
    }

    // -- State ----------------------------------------------------------------

    public String sessionId() {
        return sessionId;
    }

    public LaunchSpec launchSpec() {
        return launchSpec;
    }

    public boolean isAlive() {
        Process proc = process;
        return proc != null && proc.isAlive();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public Optional<Integer> exitCode() {
        Process proc = process;
        if (proc == null || proc.isAlive()) {
            return Optional.empty();
        }
        return Optional.of(proc.exitValue());
    }

    /**
     * Blocks until the listener has been told the output ended.
     *
     * @return false if that did not happen within the timeout
     */
    public boolean awaitClosed(long timeout, TimeUnit unit) throws InterruptedException {
        return closedSignal.await(timeout, unit);
    }

    public String nextRequestId() {
        return "req_" + requestCounter.incrementAndGet() + "_" + shortId(sessionId);
    }

    public List<String> stderrTail() {
        synchronized (stderrTail) {
            return List.copyOf(stderrTail);
        }
    }

    // -- Internals ------------------------------------------------------------

    private void releaseResources() {
        ScheduledFuture<?> scheduled = watchdog;
        if (scheduled != null) {
            scheduled.cancel(false);
        }
        writer.shutdownNow();
        closeQuietly(stdin);
    }

    private void closeQuietly(Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            log.debug("Ignoring close failure for session {}: {}", sessionId, e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String shortId(String id) {
        return id.length() > 8 ? id.substring(0, 8) : id;
    }

    /**
     * Records the time of every successful read for the idle watchdog.
     */
    private final class ActivityTrackingStream extends FilterInputStream {

        ActivityTrackingStream(InputStream in) {
            super(in);
        }

        @Override
        public int read() throws IOException {
            int b = super.read();
            if (b >= 0) {
                lastReadNanos = System.nanoTime();
            }
            return b;
        }

        @Override
        public int read(byte[] buffer, int offset, int length) throws IOException {
            int n = super.read(buffer, offset, length);
            if (n > 0) {
                lastReadNanos = System.nanoTime();
            }
            return n;
        }
    }
}
