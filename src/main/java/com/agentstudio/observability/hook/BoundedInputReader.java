package com.agentstudio.observability.hook;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Reads the hook payload from an input stream without ever blocking the invocation for long.
 * <p>
 * Reading stops at end of stream, when no byte arrives for the idle timeout (counted from the
 * first byte), when the total timeout elapses, or when the byte cap is reached. The blocking
 * reads happen on a daemon thread that is simply abandoned when a limit hits.
 *
 * @author Agent Studio 2025-2026
 */
public class BoundedInputReader {

    private static final Logger log = LoggerFactory.getLogger(BoundedInputReader.class);

    private static final byte[] END_OF_STREAM = new byte[0];
    private static final int CHUNK_SIZE = 8192;

    private final Duration idleTimeout;
    private final Duration totalTimeout;
    private final int maxBytes;

    public BoundedInputReader(Duration idleTimeout, Duration totalTimeout, int maxBytes) {
        this.idleTimeout = idleTimeout;
        this.totalTimeout = totalTimeout;
        this.maxBytes = Math.max(1, maxBytes);
    }

    /**
     * Reads what is available within the limits.
     *
     * @return the bytes read, possibly empty, never more than the cap
     */
    public byte[] read(InputStream in) {
        BlockingQueue<byte[]> chunks = new LinkedBlockingQueue<>();
        Thread reader = new Thread(() -> pump(in, chunks), "hook-stdin-reader");
        reader.setDaemon(true);
        reader.start();

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        long deadline = System.nanoTime() + totalTimeout.toNanos();
        boolean started = false;
        try {
            while (buffer.size() < maxBytes) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    log.debug("Input total timeout reached after {} bytes", buffer.size());
                    break;
                }
                long wait = started ? Math.min(remaining, idleTimeout.toNanos()) : remaining;
                byte[] chunk = chunks.poll(wait, TimeUnit.NANOSECONDS);
                if (chunk == null) {
                    if (started) {
                        log.debug("Input idle timeout reached after {} bytes", buffer.size());
                    }
                    break;
                }
                if (chunk == END_OF_STREAM) {
                    break;
                }
                started = true;
                buffer.write(chunk, 0, Math.min(chunk.length, maxBytes - buffer.size()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return buffer.toByteArray();
    }

    private static void pump(InputStream in, BlockingQueue<byte[]> chunks) {
        byte[] buf = new byte[CHUNK_SIZE];
        try {
            int n;
            while ((n = in.read(buf)) != -1) {
                if (n > 0) {
                    chunks.add(Arrays.copyOf(buf, n));
                }
            }
        } catch (IOException e) {
            log.debug("Input read failed: {}", e.getMessage());
        } finally {
            chunks.add(END_OF_STREAM);
        }
    }
}
