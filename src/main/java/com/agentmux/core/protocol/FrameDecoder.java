package com.agentmux.core.protocol;

import com.agentmux.core.error.ProtocolDecodeException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits a byte stream into newline-terminated frames and decodes each one.
 * <p>
 * Holds the unterminated tail of the last chunk between calls, so frames may arrive
 * split across any number of reads. A frame longer than the configured maximum is
 * dropped up to its terminating newline and reported as one error. Not thread-safe;
 * each stream owns its own decoder.
 */
public final class FrameDecoder {

    private static final int INITIAL_CAPACITY = 512;
    private static final int RETAINED_CAPACITY = 64 * 1024;

    private final ControlProtocolCodec codec;
    private final int maxFrameBytes;

    private byte[] pending = new byte[INITIAL_CAPACITY];
    private int pendingLength;
    private boolean discarding;
    private long discardedBytes;

    FrameDecoder(ControlProtocolCodec codec, int maxFrameBytes) {
        this.codec = codec;
        this.maxFrameBytes = maxFrameBytes;
    }

    /**
     * Consumes a chunk and returns the frames it completed, in stream order.
     */
    public List<DecodedFrame> feed(byte[] data, int offset, int length) {
        List<DecodedFrame> frames = new ArrayList<>();
        int start = offset;
        int end = offset + length;
        for (int i = offset; i < end; i++) {
            if (data[i] == '\n') {
                accumulate(data, start, i - start);
                completeFrame(frames);
                start = i + 1;
            }
        }
        accumulate(data, start, end - start);
        return frames;
    }

    /**
     * Flushes a final frame that was not newline-terminated. Call once at end of stream.
     */
    public List<DecodedFrame> finish() {
        List<DecodedFrame> frames = new ArrayList<>();
        if (pendingLength > 0 || discarding) {
            completeFrame(frames);
        }
        return frames;
    }

    /** Bytes held for the frame currently being assembled. */
    public int pendingBytes() {
        return pendingLength;
    }

    private void accumulate(byte[] data, int from, int length) {
        if (length <= 0) {
            return;
        }
        if (discarding) {
            discardedBytes += length;
            return;
        }
        if (pendingLength + length > maxFrameBytes) {
            discarding = true;
            discardedBytes = (long) pendingLength + length;
            pendingLength = 0;
            return;
        }
        if (pendingLength + length > pending.length) {
            int grown = Math.max(pending.length * 2, pendingLength + length);
            pending = Arrays.copyOf(pending, Math.min(grown, maxFrameBytes));
        }
        System.arraycopy(data, from, pending, pendingLength, length);
        pendingLength += length;
    }

    private void completeFrame(List<DecodedFrame> frames) {
        if (discarding) {
            long size = discardedBytes;
            discarding = false;
            discardedBytes = 0;
            frames.add(DecodedFrame.failed(new ProtocolDecodeException(
                    "Frame of " + size + " bytes exceeds limit of " + maxFrameBytes + " bytes; discarded"),
                    (int) Math.min(size, Integer.MAX_VALUE)));
            return;
        }

        int length = pendingLength;
        pendingLength = 0;
        if (length > 0 && pending[length - 1] == '\r') {
            length--;
        }
        if (!isBlank(pending, length)) {
            String line = new String(pending, 0, length, StandardCharsets.UTF_8);
            try {
                frames.add(DecodedFrame.of(codec.decodeFrame(line), length));
            } catch (ProtocolDecodeException e) {
                frames.add(DecodedFrame.failed(e, length));
            }
        }
        if (pending.length > RETAINED_CAPACITY) {
            pending = new byte[INITIAL_CAPACITY];
        }
    }

    private static boolean isBlank(byte[] bytes, int length) {
        for (int i = 0; i < length; i++) {
            byte b = bytes[i];
            if (b != ' ' && b != '\t' && b != '\r') {
                return false;
            }
        }
        return true;
    }
}
