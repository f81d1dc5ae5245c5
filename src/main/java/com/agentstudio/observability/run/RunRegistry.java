package com.agentstudio.observability.run;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.LockSupport;
import java.util.regex.Pattern;

/**
 * Maps a session key to its durable run id ({@code sessions/<safe-id>.json}).
 * <p>
 * The mapping is created with an exclusive create, so when two invocations race the loser
 * adopts the winner's run id.
 *
 * @author Agent Studio 2025-2026
 */
public class RunRegistry {

    private static final Logger log = LoggerFactory.getLogger(RunRegistry.class);

    private static final DateTimeFormatter RUN_ID_TIME =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);
    private static final Pattern VALID_RUN_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.-]{0,127}$");
    private static final int WINNER_READ_ATTEMPTS = 3;
    private static final long WINNER_READ_BACKOFF_NANOS = 5_000_000L;

    private final RunPaths paths;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RunRegistry(RunPaths paths, ObjectMapper objectMapper, Clock clock) {
        this.paths = paths;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Session to run mapping as persisted.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SessionMapping(
            @JsonProperty("run_id") String runId,
            @JsonProperty("session_key") String sessionKey,
            @JsonProperty("created_at") String createdAt) {
    }

    /**
     * Returns the run id for a session, creating the mapping on first use.
     * Never fails: when the mapping cannot be persisted the generated id is still returned.
     */
    public String resolveRunId(String sessionKey) {
        Path path = paths.sessionMappingPath(sessionKey);
        Optional<String> existing = readRunId(path);
        if (existing.isPresent()) {
            return existing.get();
        }

        String runId = newRunId();
        SessionMapping mapping = new SessionMapping(runId, sessionKey, Instant.now(clock).toString());
        try {
            createExclusive(path, objectMapper.writeValueAsBytes(mapping));
            log.debug("Created run {} for session {}", runId, sessionKey);
            return runId;
        } catch (FileAlreadyExistsException e) {
            log.debug("Lost run creation race for session {}, adopting existing run", sessionKey);
        } catch (IOException e) {
            log.debug("Unable to persist run mapping {}: {}", path, e.getMessage());
            return readWinner(path).orElse(runId);
        }
        Optional<String> winner = readWinner(path);
        if (winner.isPresent()) {
            return winner.get();
        }
        return replaceCorrupt(path, mapping);
    }

    /**
     * Reads an existing mapping without creating one.
     */
    public Optional<String> findRunId(String sessionKey) {
        return readRunId(paths.sessionMappingPath(sessionKey));
    }

    String newRunId() {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        return "run-" + RUN_ID_TIME.format(Instant.now(clock)) + "-" + random;
    }

    private void createExclusive(Path path, byte[] content) throws IOException {
        try {
            Files.write(path, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (NoSuchFileException e) {
            Files.createDirectories(path.getParent());
            Files.write(path, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        }
    }

    private String replaceCorrupt(Path path, SessionMapping mapping) {
        try {
            AtomicFiles.write(path, objectMapper.writeValueAsBytes(mapping));
            log.debug("Replaced unreadable run mapping {}", path);
        } catch (IOException e) {
            log.debug("Unable to replace run mapping {}: {}", path, e.getMessage());
        }
        return readRunId(path).orElse(mapping.runId());
    }

    private Optional<String> readWinner(Path path) {
        // the winner may still be writing its mapping
        for (int attempt = 0; attempt < WINNER_READ_ATTEMPTS; attempt++) {
            Optional<String> runId = readRunId(path);
            if (runId.isPresent()) {
                return runId;
            }
            LockSupport.parkNanos(WINNER_READ_BACKOFF_NANOS);
        }
        return Optional.empty();
    }

    private Optional<String> readRunId(Path path) {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            SessionMapping mapping = objectMapper.readValue(path.toFile(), SessionMapping.class);
            if (mapping == null || mapping.runId() == null || !VALID_RUN_ID.matcher(mapping.runId().trim()).matches()) {
                return Optional.empty();
            }
            return Optional.of(mapping.runId().trim());
        } catch (IOException e) {
            log.debug("Unreadable run mapping {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
