package me.golemcore.chorus.domain.stream;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StreamBufferTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void shouldFlushImmediatelyWhenNeverArmed() {
        StreamBuffer buffer = new StreamBuffer(Duration.ofMillis(200));
        buffer.enqueue("Hi");

        assertTrue(buffer.shouldFlush(T0));
    }

    @Test
    void shouldNotFlushEmptyBuffer() {
        StreamBuffer buffer = new StreamBuffer(Duration.ofMillis(200));

        assertFalse(buffer.shouldFlush(T0));
        assertNull(buffer.drain(T0));
    }

    @Test
    void shouldWaitForIntervalAfterReset() {
        StreamBuffer buffer = new StreamBuffer(Duration.ofMillis(200));
        buffer.reset(T0);
        buffer.enqueue("Hel");

        assertFalse(buffer.shouldFlush(T0.plusMillis(199)));
        assertTrue(buffer.shouldFlush(T0.plusMillis(200)));
    }

    @Test
    void shouldDrainPendingButKeepAccumulated() {
        StreamBuffer buffer = new StreamBuffer(Duration.ofMillis(100));
        buffer.reset(T0);
        buffer.enqueue("Hel");
        buffer.enqueue("lo");

        assertEquals("Hello", buffer.drain(T0.plusMillis(150)));
        assertFalse(buffer.hasPending());
        assertEquals(T0.plusMillis(150), buffer.lastFlushTime());

        buffer.enqueue(", world");
        assertFalse(buffer.shouldFlush(T0.plusMillis(200)));
        assertEquals(", world", buffer.drain(T0.plusMillis(200)));
        assertEquals("Hello, world", buffer.accumulated());
    }

    @Test
    void shouldIgnoreNullAndEmptyChunks() {
        StreamBuffer buffer = new StreamBuffer(Duration.ofMillis(100));
        buffer.enqueue(null);
        buffer.enqueue("");

        assertFalse(buffer.hasPending());
        assertEquals("", buffer.accumulated());
    }

    @Test
    void shouldClearEverythingOnReset() {
        StreamBuffer buffer = new StreamBuffer(Duration.ofMillis(100));
        buffer.enqueue("stale");
        buffer.reset(T0);

        assertFalse(buffer.hasPending());
        assertEquals("", buffer.accumulated());
        assertEquals(T0, buffer.lastFlushTime());
    }
}
