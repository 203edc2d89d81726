package com.agentmux.testing;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

/**
 * In-memory stand-in for an agent subprocess.
 * <p>
 * Tests push stdout and stderr lines, inspect what was written to stdin and decide when
 * and how the process exits. An optional handler is called for every line written to
 * stdin, which is enough to script a conversational agent.
 */
public class FakeAgentProcess extends Process {

    public static final int SIGTERM_EXIT = 143;
    public static final int SIGKILL_EXIT = 137;

    private final QueueInputStream stdout = new QueueInputStream();
    private final QueueInputStream stderr = new QueueInputStream();
    private final StdinRecorder stdin = new StdinRecorder();
    private final CompletableFuture<Integer> exit = new CompletableFuture<>();
    private final CountDownLatch killed = new CountDownLatch(1);

    private volatile BiConsumer<FakeAgentProcess, String> lineHandler = (process, line) -> {};
    private volatile Integer exitOnStdinClose;
    private volatile int acceptedWritesBeforeBlocking = Integer.MAX_VALUE;
    private volatile boolean forciblyDestroyed;
    private volatile InputStream stderrSource;

    // -- Scripting ------------------------------------------------------------

    public FakeAgentProcess onLine(BiConsumer<FakeAgentProcess, String> handler) {
        this.lineHandler = handler;
        return this;
    }

    /** Exit with {@code code} as soon as stdin is closed, like an agent that ran out of input. */
    public FakeAgentProcess exitOnStdinClose(int code) {
        this.exitOnStdinClose = code;
        return this;
    }

    /** Accept {@code count} writes, then block every further write until the process dies. */
    public FakeAgentProcess blockWritesAfter(int count) {
        this.acceptedWritesBeforeBlocking = count;
        return this;
    }

    /** Serves stderr from {@code source} instead of lines pushed with {@link #emitStderr}. */
    public FakeAgentProcess stderrSource(InputStream source) {
        this.stderrSource = source;
        return this;
    }

    public void emit(String jsonLine) {
        stdout.push((jsonLine + "\n").getBytes(StandardCharsets.UTF_8));
    }

    public void emitRaw(byte[] bytes) {
        stdout.push(bytes);
    }

    public void emitStderr(String line) {
        stderr.push((line + "\n").getBytes(StandardCharsets.UTF_8));
    }

    /** Closes stdout without exiting. */
    public void closeOutput() {
        stdout.end();
    }

    public void exit(int code) {
        if (exit.complete(code)) {
            killed.countDown();
            stdout.end();
            stderr.end();
        }
    }

    // -- Inspection -----------------------------------------------------------

    public List<String> writtenLines() {
        return stdin.lines();
    }

    /**
     * Waits until at least {@code count} lines were written to stdin.
     */
    public List<String> awaitWrittenLines(int count, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (stdin.lines().size() < count) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Expected " + count + " lines on stdin but got " + stdin.lines());
            }
            Thread.sleep(10);
        }
        return stdin.lines();
    }

    public boolean isStdinClosed() {
        return stdin.closed;
    }

    public boolean wasForciblyDestroyed() {
        return forciblyDestroyed;
    }

    // -- Process --------------------------------------------------------------

    @Override
    public OutputStream getOutputStream() {
        return stdin;
    }

    @Override
    public InputStream getInputStream() {
        return stdout;
    }

    @Override
    public InputStream getErrorStream() {
        InputStream source = stderrSource;
        return source != null ? source : stderr;
    }

    @Override
    public int waitFor() throws InterruptedException {
        try {
            return exit.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
        try {
            exit.get(timeout, unit);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public int exitValue() {
        Integer code = exit.getNow(null);
        if (code == null) {
            throw new IllegalThreadStateException("process has not exited");
        }
        return code;
    }

    @Override
    public boolean isAlive() {
        return !exit.isDone();
    }

    @Override
    public void destroy() {
        exit(SIGTERM_EXIT);
    }

    @Override
    public Process destroyForcibly() {
        forciblyDestroyed = true;
        exit(SIGKILL_EXIT);
        return this;
    }

    // -- Streams --------------------------------------------------------------

    /**
     * Blocking stdout/stderr backed by a queue of chunks. An empty chunk marks end of stream.
     */
    private static final class QueueInputStream extends InputStream {

        private static final byte[] EOF = new byte[0];

        private final LinkedBlockingQueue<byte[]> chunks = new LinkedBlockingQueue<>();
        private byte[] current;
        private int position;
        private boolean ended;

        void push(byte[] chunk) {
            if (chunk.length > 0) {
                chunks.add(chunk);
            }
        }

        void end() {
            chunks.add(EOF);
        }

        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            int n = read(one, 0, 1);
            return n < 0 ? -1 : one[0] & 0xff;
        }

        @Override
        public synchronized int read(byte[] buffer, int offset, int length) throws IOException {
            if (length == 0) {
                return 0;
            }
            if (ended) {
                return -1;
            }
            if (current == null || position == current.length) {
                try {
                    current = chunks.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("interrupted while reading");
                }
                position = 0;
                if (current == EOF) {
                    ended = true;
                    return -1;
                }
            }
            int n = Math.min(length, current.length - position);
            System.arraycopy(current, position, buffer, offset, n);
            position += n;
            return n;
        }

        @Override
        public void close() {
            end();
        }
    }

    /**
     * Records stdin line by line and runs the line handler for each one.
     */
    private final class StdinRecorder extends OutputStream {

        private final List<String> lines = new CopyOnWriteArrayList<>();
        private final StringBuilder partial = new StringBuilder();
        private final AtomicInteger writes = new AtomicInteger();
        private volatile boolean closed;

        List<String> lines() {
            return new ArrayList<>(lines);
        }

        @Override
        public void write(int b) throws IOException {
            write(new byte[] {(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] buffer, int offset, int length) throws IOException {
            if (closed || !isAlive()) {
                throw new IOException("Broken pipe");
            }
            if (writes.incrementAndGet() > acceptedWritesBeforeBlocking) {
                try {
                    killed.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("interrupted while writing");
                }
                throw new IOException("Broken pipe");
            }
            List<String> completed = new ArrayList<>();
            synchronized (partial) {
                partial.append(new String(buffer, offset, length, StandardCharsets.UTF_8));
                int newline;
                while ((newline = partial.indexOf("\n")) >= 0) {
                    completed.add(partial.substring(0, newline));
                    partial.delete(0, newline + 1);
                }
            }
            for (String line : completed) {
                lines.add(line);
                lineHandler.accept(FakeAgentProcess.this, line);
            }
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            Integer code = exitOnStdinClose;
            if (code != null) {
                exit(code);
            }
        }
    }
}
