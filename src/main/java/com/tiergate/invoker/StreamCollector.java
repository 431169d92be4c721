package com.tiergate.invoker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Drains a process stream into memory on its own thread.
 * Text read so far stays available even if the stream never reaches end-of-file.
 * Bytes past {@code maxBytes} are still read, then discarded and counted.
 */
final class StreamCollector implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StreamCollector.class);

    static final int DEFAULT_MAX_CAPTURE_BYTES = 64 * 1024;

    private static final int BUFFER_SIZE = 4096;

    private final InputStream stream;
    private final String name;
    private final int maxBytes;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private long dropped;

    StreamCollector(InputStream stream, String name) {
        this(stream, name, DEFAULT_MAX_CAPTURE_BYTES);
    }

    StreamCollector(InputStream stream, String name, int maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive: " + maxBytes);
        }
        this.stream = stream;
        this.name = name;
        this.maxBytes = maxBytes;
    }

    @Override
    public void run() {
        byte[] chunk = new byte[BUFFER_SIZE];
        try (InputStream in = stream) {
            int read;
            while ((read = in.read(chunk)) != -1) {
                synchronized (buffer) {
                    int kept = Math.min(read, maxBytes - buffer.size());
                    if (kept > 0) {
                        buffer.write(chunk, 0, kept);
                    }
                    dropped += read - Math.max(kept, 0);
                }
            }
        } catch (IOException e) {
            // Stream closed under us when the process was killed
            log.debug("Stopped reading {}: {}", name, e.getMessage());
        }
        if (dropped > 0) {
            log.debug("Truncated {}: kept {} bytes, dropped {}", name, maxBytes, dropped);
        }
    }

    /**
     * Text collected so far, trimmed, with a marker when output past the cap was dropped.
     */
    String text() {
        synchronized (buffer) {
            String text = buffer.toString(StandardCharsets.UTF_8).trim();
            if (dropped == 0) {
                return text;
            }
            return text + "\n[output truncated, " + dropped + " bytes dropped]";
        }
    }
}
