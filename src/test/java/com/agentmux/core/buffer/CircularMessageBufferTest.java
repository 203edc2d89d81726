package com.agentmux.core.buffer;

import com.agentmux.core.protocol.ContentBlock;
import com.agentmux.core.protocol.AssistantOutput;
import com.agentmux.core.protocol.ProtocolMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class CircularMessageBufferTest {

    private CircularMessageBuffer buffer;

    @BeforeEach
    void setUp() {
        buffer = new CircularMessageBuffer(5, 1_000_000);
    }

    private static ProtocolMessage text(String value) {
        return new AssistantOutput("test-model", List.of(new ContentBlock.TextBlock(value)));
    }

    private void appendN(int n) {
        for (int i = 0; i < n; i++) {
            buffer.append(text("m" + i), 10);
        }
    }

    private static void assertContiguous(BufferSlice slice) {
        List<BufferedMessage> messages = slice.messages();
        for (int i = 1; i < messages.size(); i++) {
            assertEquals(messages.get(i - 1).sequence() + 1, messages.get(i).sequence(),
                    "sequence gap at index " + i);
        }
    }

    // -- Append tests ---------------------------------------------------------

    @Nested
    @DisplayName("append")
    class AppendTests {

        @Test
        @DisplayName("assigns increasing sequence numbers from zero")
        void assignsSequenceNumbers() {
            assertEquals(0, buffer.append(text("a"), 1));
            assertEquals(1, buffer.append(text("b"), 1));
            assertEquals(2, buffer.nextSequence());
        }

        @Test
        @DisplayName("keeps at most capacity messages")
        void keepsAtMostCapacity() {
            appendN(12);
            assertEquals(5, buffer.size());
            assertEquals(7, buffer.floor());
            assertEquals(12, buffer.nextSequence());
        }

        @Test
        @DisplayName("tracks retained bytes as messages are overwritten")
        void tracksRetainedBytes() {
            appendN(3);
            assertEquals(30, buffer.retainedBytes());
            appendN(10);
            assertEquals(50, buffer.retainedBytes());
        }

        @Test
        @DisplayName("rejects non-positive capacity")
        void rejectsBadCapacity() {
            assertThrows(IllegalArgumentException.class, () -> new CircularMessageBuffer(0, 10));
            assertThrows(IllegalArgumentException.class, () -> new CircularMessageBuffer(10, 0));
        }
    }

    // -- Read tests -----------------------------------------------------------

    @Nested
    @DisplayName("read")
    class ReadTests {

        @Test
        @DisplayName("returns all messages when fewer than capacity were appended")
        void returnsAllWhenNotFull() {
            appendN(3);

            BufferSlice slice = buffer.read(0, 10);

            assertEquals(3, slice.messages().size());
            assertFalse(slice.truncated());
            assertEquals(0, slice.messages().get(0).sequence());
            assertEquals(3, slice.nextOffset());
        }

        @Test
        @DisplayName("marks the slice truncated when the offset was already evicted")
        void marksTruncatedAfterWrap() {
            appendN(8);

            BufferSlice slice = buffer.read(0, 10);

            assertTrue(slice.truncated());
            assertEquals(5, slice.messages().size());
            assertEquals(3, slice.messages().get(0).sequence());
            assertEquals(7, slice.messages().get(4).sequence());
            assertEquals(8, slice.nextOffset());
            assertContiguous(slice);
        }

        @Test
        @DisplayName("reading from the floor is not truncated")
        void readingFromFloorNotTruncated() {
            appendN(8);

            BufferSlice slice = buffer.read(buffer.floor(), 2);

            assertFalse(slice.truncated());
            assertEquals(List.of(3L, 4L), slice.messages().stream().map(BufferedMessage::sequence).toList());
            assertEquals(5, slice.nextOffset());
        }

        @Test
        @DisplayName("offset at or past the end yields an empty slice")
        void offsetPastEndIsEmpty() {
            appendN(2);

            BufferSlice atEnd = buffer.read(2, 10);
            BufferSlice pastEnd = buffer.read(40, 10);

            assertTrue(atEnd.isEmpty());
            assertFalse(atEnd.truncated());
            assertEquals(2, atEnd.nextOffset());
            assertTrue(pastEnd.isEmpty());
            assertEquals(40, pastEnd.nextOffset());
        }

        @Test
        @DisplayName("empty buffer reads empty and not truncated")
        void emptyBuffer() {
            BufferSlice slice = buffer.read(0, 10);
            assertTrue(slice.isEmpty());
            assertFalse(slice.truncated());
            assertEquals(0, slice.nextOffset());
        }

        @Test
        @DisplayName("paging with nextOffset visits every retained message once")
        void pagingVisitsEachMessageOnce() {
            appendN(5);

            BufferSlice first = buffer.read(0, 2);
            BufferSlice second = buffer.read(first.nextOffset(), 2);
            BufferSlice third = buffer.read(second.nextOffset(), 2);

            assertEquals(2, first.messages().size());
            assertEquals(2, second.messages().size());
            assertEquals(1, third.messages().size());
            assertEquals(4, third.messages().get(0).sequence());
        }

        @Test
        @DisplayName("rejects negative offsets and non-positive limits")
        void rejectsBadArguments() {
            assertThrows(IllegalArgumentException.class, () -> buffer.read(-1, 5));
            assertThrows(IllegalArgumentException.class, () -> buffer.read(0, 0));
        }
    }

    // -- Tail tests -----------------------------------------------------------

    @Nested
    @DisplayName("readTail")
    class TailTests {

        @Test
        @DisplayName("returns the newest messages in order")
        void returnsNewest() {
            appendN(9);

            BufferSlice tail = buffer.readTail(2);

            assertEquals(List.of(7L, 8L), tail.messages().stream().map(BufferedMessage::sequence).toList());
            assertFalse(tail.truncated());
            assertEquals(9, tail.nextOffset());
        }

        @Test
        @DisplayName("is capped at what is retained")
        void cappedAtRetained() {
            appendN(3);
            assertEquals(3, buffer.readTail(50).messages().size());
            appendN(10);
            assertEquals(5, buffer.readTail(50).messages().size());
        }
    }

    // -- Byte cap tests -------------------------------------------------------

    @Nested
    @DisplayName("byte cap")
    class ByteCapTests {

        @Test
        @DisplayName("evicts oldest messages once the byte cap is exceeded")
        void evictsOnByteCap() {
            var small = new CircularMessageBuffer(100, 250);
            for (int i = 0; i < 5; i++) {
                small.append(text("m" + i), 100);
            }

            assertEquals(2, small.size());
            assertEquals(3, small.floor());
            assertEquals(200, small.retainedBytes());

            BufferSlice slice = small.read(0, 10);
            assertTrue(slice.truncated());
            assertEquals(3, slice.messages().get(0).sequence());
        }

        @Test
        @DisplayName("always retains the newest message even if it alone exceeds the cap")
        void retainsOversizeNewest() {
            var small = new CircularMessageBuffer(10, 50);
            small.append(text("a"), 10);
            small.append(text("huge"), 500);

            assertEquals(1, small.size());
            BufferSlice slice = small.read(0, 10);
            assertEquals(1, slice.messages().size());
            assertEquals(1, slice.messages().get(0).sequence());
            assertTrue(slice.truncated());
        }
    }

    // -- Concurrency tests ----------------------------------------------------

    @Nested
    @DisplayName("concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("readers racing the writer only ever see contiguous, correctly flagged slices")
        void readersSeeContiguousSlices() throws InterruptedException {
            var shared = new CircularMessageBuffer(16, 1_000_000);
            int total = 50_000;
            int readers = 4;
            AtomicBoolean done = new AtomicBoolean();
            List<String> failures = new CopyOnWriteArrayList<>();
            CountDownLatch finished = new CountDownLatch(readers);

            for (int r = 0; r < readers; r++) {
                new Thread(() -> {
                    long offset = 0;
                    while (!done.get()) {
                        BufferSlice slice = shared.read(offset, 8);
                        List<BufferedMessage> messages = slice.messages();
                        if (!messages.isEmpty()) {
                            long first = messages.get(0).sequence();
                            if (first != offset && !slice.truncated()) {
                                failures.add("gap without truncation at " + offset + " -> " + first);
                            }
                            for (int i = 0; i < messages.size(); i++) {
                                if (messages.get(i).sequence() != first + i) {
                                    failures.add("non-contiguous slice starting at " + first);
                                }
                            }
                        }
                        offset = slice.nextOffset();
                    }
                    finished.countDown();
                }).start();
            }

            for (int i = 0; i < total; i++) {
                shared.append(text("m"), 1);
            }
            done.set(true);

            assertTrue(finished.await(10, TimeUnit.SECONDS));
            assertTrue(failures.isEmpty(), () -> failures.get(0));
            assertEquals(total, shared.nextSequence());
        }
    }
}
