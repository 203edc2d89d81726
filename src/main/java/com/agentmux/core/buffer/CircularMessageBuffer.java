package com.agentmux.core.buffer;

import com.agentmux.core.protocol.ProtocolMessage;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Fixed-capacity ring of the most recent messages of one session.
 * <p>
 * One writer (the session's read loop) appends; any number of readers read concurrently
 * without locks. Each slot holds an immutable {@link BufferedMessage}, and the message's
 * own sequence number doubles as the slot generation: a reader that finds a slot holding a
 * different sequence than it expected knows the writer lapped it, discards what it has and
 * retries from the new floor, reporting truncation.
 * <p>
 * Besides the slot count, the total payload size is capped. When an append pushes the
 * retained bytes over the cap, the oldest messages are evicted early by raising the floor.
 * The newest message is always retained, even if it alone exceeds the cap.
 */
public class CircularMessageBuffer {

    public static final int DEFAULT_CAPACITY = 1000;
    public static final long DEFAULT_MAX_BYTES = 1024L * 1024L;

    private final int capacity;
    private final long maxBytes;
    private final Clock clock;
    private final AtomicReferenceArray<BufferedMessage> slots;

    /** Sequence number the next append will receive. Published after the slot write. */
    private volatile long next;

    /** Lowest sequence not yet evicted by the byte cap. */
    private volatile long byteFloor;

    /** Payload bytes of the retained window. Written only by the appending thread. */
    private volatile long retainedBytes;

    public CircularMessageBuffer() {
        this(DEFAULT_CAPACITY, DEFAULT_MAX_BYTES, Clock.systemUTC());
    }

    public CircularMessageBuffer(int capacity, long maxBytes) {
        this(capacity, maxBytes, Clock.systemUTC());
    }

    public CircularMessageBuffer(int capacity, long maxBytes, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive: " + maxBytes);
        }
        this.capacity = capacity;
        this.maxBytes = maxBytes;
        this.clock = clock;
        this.slots = new AtomicReferenceArray<>(capacity);
    }

    /**
     * Appends a message, evicting the oldest if the ring is full or the byte cap is exceeded.
     * Must only be called from the single writer thread.
     *
     * @return the sequence number assigned to the message
     */
    public long append(ProtocolMessage payload, int sizeBytes) {
        long seq = next;
        int size = Math.max(0, sizeBytes);
        long bytes = retainedBytes;
        long floor = byteFloor;

        int index = indexOf(seq);
        BufferedMessage overwritten = slots.get(index);
        if (overwritten != null && overwritten.sequence() >= floor) {
            bytes -= overwritten.sizeBytes();
        }
        slots.set(index, new BufferedMessage(seq, clock.instant(), payload, size));
        bytes += size;

        long oldest = Math.max(floor, seq + 1 - capacity);
        while (bytes > maxBytes && oldest < seq) {
            bytes -= slots.get(indexOf(oldest)).sizeBytes();
            oldest++;
        }

        if (oldest > floor) {
            byteFloor = oldest;
        }
        retainedBytes = bytes;
        next = seq + 1;
        return seq;
    }

    /**
     * Reads up to {@code maxCount} messages starting at {@code startOffset}.
     * <p>
     * If {@code startOffset} is below the retained floor, reading starts at the floor and the
     * slice is marked truncated. An offset at or past the end yields an empty slice whose
     * {@code nextOffset} is the requested offset.
     */
    public BufferSlice read(long startOffset, int maxCount) {
        if (startOffset < 0) {
            throw new IllegalArgumentException("startOffset must be >= 0: " + startOffset);
        }
        if (maxCount <= 0) {
            throw new IllegalArgumentException("maxCount must be > 0: " + maxCount);
        }

        boolean truncated = false;
        long from = startOffset;
        while (true) {
            long end = next;
            long floor = floorFor(end);
            if (from < floor) {
                truncated = true;
                from = floor;
            }
            if (from >= end) {
                return new BufferSlice(List.of(), truncated, from);
            }

            int count = (int) Math.min(maxCount, end - from);
            List<BufferedMessage> messages = new ArrayList<>(count);
            boolean lapped = false;
            for (long seq = from; seq < from + count; seq++) {
                BufferedMessage message = slots.get(indexOf(seq));
                if (message == null || message.sequence() != seq) {
                    lapped = true;
                    break;
                }
                messages.add(message);
            }
            if (!lapped) {
                return new BufferSlice(messages, truncated, from + count);
            }
            // The writer overwrote part of the window; the floor has moved past 'from'.
        }
    }

    /**
     * Reads the last {@code count} retained messages.
     */
    public BufferSlice readTail(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0: " + count);
        }
        long end = next;
        long from = Math.max(floorFor(end), end - count);
        return read(from, count);
    }

    /** Lowest sequence number still readable. */
    public long floor() {
        return floorFor(next);
    }

    /** Sequence number the next append will receive; also the total number of appends. */
    public long nextSequence() {
        return next;
    }

    /** Number of messages currently retained. */
    public int size() {
        long end = next;
        return (int) Math.max(0, end - floorFor(end));
    }

    public long retainedBytes() {
        return retainedBytes;
    }

    public int capacity() {
        return capacity;
    }

    public long maxBytes() {
        return maxBytes;
    }

    private long floorFor(long end) {
        return Math.max(Math.max(0, end - capacity), byteFloor);
    }

    private int indexOf(long seq) {
        return (int) (seq % capacity);
    }
}
