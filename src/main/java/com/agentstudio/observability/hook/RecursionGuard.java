package com.agentstudio.observability.hook;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Detects an observer invocation nested inside another one, so the inner invocation only
 * answers and records nothing.
 * <p>
 * Nesting is signalled either by the explicit environment flag or by a marker file that a
 * live ancestor process left under the guards directory. A marker records the start instant of
 * the process that wrote it; a marker whose process is gone, or whose pid now belongs to a
 * different process, is stale and removed.
 *
 * @author Agent Studio 2025-2026
 */
public class RecursionGuard {

    private static final Logger log = LoggerFactory.getLogger(RecursionGuard.class);

    static final String MARKER_SUFFIX = ".active";

    private final Path guardsDir;
    private final HookEnvironment environment;
    private final long selfPid;
    private final Supplier<List<Long>> ancestorPids;
    private final Function<Long, Optional<String>> processStart;
    private volatile Marker held;

    public RecursionGuard(Path guardsDir, HookEnvironment environment) {
        this(guardsDir, environment, ProcessHandle.current().pid(), RecursionGuard::currentAncestors);
    }

    RecursionGuard(Path guardsDir, HookEnvironment environment, long selfPid, Supplier<List<Long>> ancestorPids) {
        this(guardsDir, environment, selfPid, ancestorPids, RecursionGuard::liveProcessStart);
    }

    /**
     * @param processStart start token of a live process, empty when no such process exists
     */
    RecursionGuard(Path guardsDir, HookEnvironment environment, long selfPid, Supplier<List<Long>> ancestorPids,
                   Function<Long, Optional<String>> processStart) {
        this.guardsDir = guardsDir;
        this.environment = environment;
        this.selfPid = selfPid;
        this.ancestorPids = ancestorPids;
        this.processStart = processStart;
    }

    /**
     * @return true when this invocation runs inside another observer invocation
     */
    public boolean isNested() {
        Optional<String> flag = environment.get(HookEnvironment.RECURSION_FLAG);
        if (flag.isPresent() && isTruthy(flag.get())) {
            log.debug("Recursion flag {} set", HookEnvironment.RECURSION_FLAG);
            return true;
        }
        for (Long pid : ancestorPids.get()) {
            Path marker = markerPath(pid);
            if (Files.exists(marker) && isLive(pid, marker)) {
                log.debug("Ancestor process {} holds an observer marker", pid);
                return true;
            }
        }
        return false;
    }

    private boolean isLive(long pid, Path marker) {
        String recorded;
        try {
            recorded = Files.readString(marker, StandardCharsets.UTF_8).trim();
        } catch (NoSuchFileException e) {
            return false;
        } catch (IOException e) {
            log.debug("Unable to read recursion marker {}: {}", marker, e.getMessage());
            return true;
        }
        Optional<String> start = processStart.apply(pid);
        if (start.isPresent() && start.get().equals(recorded)) {
            return true;
        }
        log.debug("Removing stale recursion marker {}", marker);
        try {
            Files.deleteIfExists(marker);
        } catch (IOException e) {
            log.debug("Unable to remove stale recursion marker {}: {}", marker, e.getMessage());
        }
        return false;
    }

    /**
     * Leaves a marker for this process that descendants will see until the returned handle is closed.
     *
     * @throws IOException if the marker cannot be written
     */
    public Marker enter() throws IOException {
        Path marker = markerPath(selfPid);
        Files.createDirectories(guardsDir);
        String start = processStart.apply(selfPid).orElse("");
        Files.write(marker, start.getBytes(StandardCharsets.UTF_8));
        Marker entered = new Marker(marker);
        held = entered;
        return entered;
    }

    /**
     * Removes the marker this process holds, if any. Used when the process is about to be
     * terminated without unwinding.
     */
    public void release() {
        Marker marker = held;
        if (marker != null) {
            marker.close();
        }
    }

    Path markerPath(long pid) {
        return guardsDir.resolve(pid + MARKER_SUFFIX);
    }

    private static boolean isTruthy(String value) {
        String v = value.toLowerCase(Locale.ROOT);
        return !v.equals("0") && !v.equals("false") && !v.equals("no");
    }

    private static Optional<String> liveProcessStart(long pid) {
        return ProcessHandle.of(pid)
                .filter(ProcessHandle::isAlive)
                .map(handle -> handle.info().startInstant().map(Instant::toString).orElse(""));
    }

    private static List<Long> currentAncestors() {
        List<Long> pids = new ArrayList<>();
        Optional<ProcessHandle> parent = ProcessHandle.current().parent();
        while (parent.isPresent() && pids.size() < 32) {
            pids.add(parent.get().pid());
            parent = parent.get().parent();
        }
        return pids;
    }

    /**
     * Handle on this process's marker; closing removes it.
     */
    public static final class Marker implements AutoCloseable {

        private final Path path;

        Marker(Path path) {
            this.path = path;
        }

        public Path path() {
            return path;
        }

        @Override
        public void close() {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                log.debug("Unable to remove recursion marker {}: {}", path, e.getMessage());
            }
        }
    }
}
