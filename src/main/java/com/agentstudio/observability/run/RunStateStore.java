package com.agentstudio.observability.run;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.function.Function;

/**
 * Reads and atomically replaces the run document.
 * <p>
 * There is no cross-process lock. Writers detect a concurrent commit by comparing the file
 * fingerprint they read with the one present just before their own commit, and re-apply their
 * mutation on fresh state a bounded number of times. After that the last write wins.
 *
 * @author Agent Studio 2025-2026
 */
public class RunStateStore {

    private static final Logger log = LoggerFactory.getLogger(RunStateStore.class);

    private final RunPaths paths;
    private final ObjectMapper objectMapper;
    private final int maxWriteRetries;
    private final Clock clock;

    public RunStateStore(RunPaths paths, ObjectMapper objectMapper, int maxWriteRetries, Clock clock) {
        this.paths = paths;
        this.objectMapper = objectMapper;
        this.maxWriteRetries = Math.max(0, maxWriteRetries);
        this.clock = clock;
    }

    /**
     * Reads the run document. A missing or malformed file yields a fresh default document.
     */
    public RunState read(String runId, String sessionKey) {
        return load(runId, sessionKey).state();
    }

    /**
     * Loads the document, applies {@code mutation} and commits the result.
     *
     * @param mutation changes the document and returns a value derived from it; it may run more
     *                 than once when a concurrent writer is detected, so it must only touch the
     *                 document it is given
     * @return the value returned by the committed application of the mutation
     * @throws IOException if the final write or rename fails
     */
    public <T> T update(String runId, String sessionKey, Function<RunState, T> mutation) throws IOException {
        Path path = paths.statePath(runId);
        for (int attempt = 0; ; attempt++) {
            Snapshot snapshot = load(runId, sessionKey);
            RunState state = snapshot.state();
            T result = mutation.apply(state);
            state.setRevision(snapshot.fingerprint().revision() + 1);
            byte[] content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(state);

            if (attempt < maxWriteRetries && !snapshot.fingerprint().equals(fingerprint(path))) {
                log.debug("Run {} changed while updating (attempt {}), re-applying", runId, attempt + 1);
                continue;
            }
            AtomicFiles.write(path, content);
            return result;
        }
    }

    /**
     * Writes the document as is.
     *
     * @throws IOException if the write or rename fails
     */
    public void write(RunState state) throws IOException {
        AtomicFiles.write(paths.statePath(state.getRunId()),
                objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(state));
    }

    Snapshot load(String runId, String sessionKey) {
        Path path = paths.statePath(runId);
        byte[] content;
        Fingerprint fingerprint;
        try {
            fingerprint = fingerprint(path);
            content = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            return new Snapshot(fresh(runId, sessionKey), Fingerprint.MISSING);
        } catch (IOException e) {
            log.debug("Unable to read run state {}: {}", path, e.getMessage());
            return new Snapshot(fresh(runId, sessionKey), Fingerprint.MISSING);
        }
        try {
            RunState state = objectMapper.readValue(content, RunState.class);
            if (state == null) {
                return new Snapshot(fresh(runId, sessionKey), fingerprint);
            }
            if (state.getRunId() == null) {
                state.setRunId(runId);
            }
            if (state.getSessionKey() == null) {
                state.setSessionKey(sessionKey);
            }
            if (state.getStartedAt() == null) {
                state.setStartedAt(Instant.now(clock).toString());
            }
            return new Snapshot(state, fingerprint);
        } catch (IOException e) {
            log.debug("Malformed run state {}, starting fresh: {}", path, e.getMessage());
            return new Snapshot(fresh(runId, sessionKey), fingerprint);
        }
    }

    private RunState fresh(String runId, String sessionKey) {
        return RunState.createDefault(runId, sessionKey, Instant.now(clock).toString());
    }

    Fingerprint fingerprint(Path path) {
        try {
            if (!Files.exists(path)) {
                return Fingerprint.MISSING;
            }
            long size = Files.size(path);
            long modified = Files.getLastModifiedTime(path).toMillis();
            return new Fingerprint(true, size, modified, readRevision(path));
        } catch (IOException e) {
            log.debug("Unable to fingerprint {}: {}", path, e.getMessage());
            return Fingerprint.MISSING;
        }
    }

    private long readRevision(Path path) {
        try {
            JsonNode node = objectMapper.readTree(path.toFile());
            return node == null ? 0L : node.path("revision").asLong(0L);
        } catch (IOException e) {
            log.debug("Unreadable revision in {}: {}", path, e.getMessage());
            return 0L;
        }
    }

    /**
     * Identity of one committed version of the document.
     */
    record Fingerprint(boolean exists, long size, long modifiedMillis, long revision) {

        static final Fingerprint MISSING = new Fingerprint(false, -1L, -1L, 0L);
    }

    record Snapshot(RunState state, Fingerprint fingerprint) {
    }
}
