package com.agentstudio.observability.hook;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Hard wall-clock limit for one invocation. When it expires the default response is written
 * and the process is terminated, whatever the pipeline is doing.
 *
 * @author Agent Studio 2025-2026
 */
public class InvocationDeadline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InvocationDeadline.class);

    /** Environment variable overriding the default limit, in milliseconds. */
    public static final String TIMEOUT_VARIABLE = "CLAUDE_HOOK_TIMEOUT_MS";

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(2500);

    private final Duration timeout;
    private final HookResponseWriter writer;
    private final Runnable onExpiry;
    private final AtomicBoolean expired = new AtomicBoolean(false);
    private final List<Runnable> cleanups = new CopyOnWriteArrayList<>();
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pending;

    public InvocationDeadline(Duration timeout, HookResponseWriter writer) {
        this(timeout, writer, () -> Runtime.getRuntime().halt(0));
    }

    InvocationDeadline(Duration timeout, HookResponseWriter writer, Runnable onExpiry) {
        this.timeout = timeout;
        this.writer = writer;
        this.onExpiry = onExpiry;
    }

    /**
     * Parses the limit from the raw environment value, falling back to {@link #DEFAULT_TIMEOUT}.
     */
    public static Duration timeoutFrom(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_TIMEOUT;
        }
        try {
            long millis = Long.parseLong(raw.trim());
            return millis > 0 ? Duration.ofMillis(millis) : DEFAULT_TIMEOUT;
        } catch (NumberFormatException e) {
            log.debug("Ignoring invalid {}={}", TIMEOUT_VARIABLE, raw);
            return DEFAULT_TIMEOUT;
        }
    }

    public synchronized InvocationDeadline arm() {
        if (scheduler != null) {
            return this;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "hook-deadline");
            thread.setDaemon(true);
            return thread;
        });
        pending = scheduler.schedule(this::expire, timeout.toMillis(), TimeUnit.MILLISECONDS);
        return this;
    }

    /**
     * Registers an action run on expiry before the process is terminated.
     */
    public InvocationDeadline beforeTermination(Runnable cleanup) {
        cleanups.add(cleanup);
        return this;
    }

    public boolean isExpired() {
        return expired.get();
    }

    private void expire() {
        expired.set(true);
        log.warn("Hook invocation exceeded {} ms, answering with the default response", timeout.toMillis());
        writer.emitDefault();
        for (Runnable cleanup : cleanups) {
            try {
                cleanup.run();
            } catch (RuntimeException e) {
                log.debug("Cleanup before termination failed: {}", e.toString());
            }
        }
        onExpiry.run();
    }

    /**
     * Disarms the watchdog.
     */
    @Override
    public synchronized void close() {
        if (pending != null) {
            pending.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
