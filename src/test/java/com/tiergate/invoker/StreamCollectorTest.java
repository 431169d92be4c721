package com.tiergate.invoker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StreamCollector.
 */
class StreamCollectorTest {

    private static StreamCollector drain(byte[] bytes, int maxBytes) {
        StreamCollector collector = new StreamCollector(new ByteArrayInputStream(bytes), "test", maxBytes);
        collector.run();
        return collector;
    }

    // ==================== Under the cap ====================

    @Test
    @DisplayName("Output under the cap is kept whole and trimmed")
    void keepsShortOutput() {
        StreamCollector collector = drain("  hello\n".getBytes(StandardCharsets.UTF_8), 64);

        assertEquals("hello", collector.text());
    }

    @Test
    @DisplayName("Output exactly at the cap carries no marker")
    void exactlyAtCap() {
        StreamCollector collector = drain("abcdefgh".getBytes(StandardCharsets.UTF_8), 8);

        assertEquals("abcdefgh", collector.text());
    }

    // ==================== Over the cap ====================

    @Test
    @DisplayName("Output past the cap is dropped and reported")
    void truncatesLongOutput() {
        byte[] big = "x".repeat(10_000).getBytes(StandardCharsets.UTF_8);

        StreamCollector collector = drain(big, 1024);

        assertEquals("x".repeat(1024) + "\n[output truncated, 8976 bytes dropped]", collector.text());
    }

    @Test
    @DisplayName("Stream is drained to the end even after the cap is hit")
    void drainsPastCap() {
        CountingStream in = new CountingStream(new byte[200_000]);
        StreamCollector collector = new StreamCollector(in, "test", 100);

        collector.run();

        assertEquals(200_000, in.consumed);
        assertTrue(collector.text().endsWith("[output truncated, 199900 bytes dropped]"));
    }

    @Test
    @DisplayName("Default collector caps at 64 KiB")
    void defaultCap() {
        byte[] big = "y".repeat(StreamCollector.DEFAULT_MAX_CAPTURE_BYTES + 10).getBytes(StandardCharsets.UTF_8);
        StreamCollector collector = new StreamCollector(new ByteArrayInputStream(big), "test");

        collector.run();

        assertTrue(collector.text().startsWith("y".repeat(StreamCollector.DEFAULT_MAX_CAPTURE_BYTES) + "\n"));
        assertTrue(collector.text().endsWith("[output truncated, 10 bytes dropped]"));
    }

    @Test
    @DisplayName("Non-positive cap is rejected")
    void rejectsBadCap() {
        assertThrows(IllegalArgumentException.class,
                () -> new StreamCollector(new ByteArrayInputStream(new byte[0]), "test", 0));
    }

    private static final class CountingStream extends InputStream {
        private final ByteArrayInputStream delegate;
        private long consumed;

        CountingStream(byte[] bytes) {
            this.delegate = new ByteArrayInputStream(bytes);
        }

        @Override
        public int read() {
            int b = delegate.read();
            if (b != -1) {
                consumed++;
            }
            return b;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            int n = delegate.read(b, off, len);
            if (n > 0) {
                consumed += n;
            }
            return n;
        }
    }
}
