package com.agentstudio.observability.session;

import com.agentstudio.observability.run.AtomicFiles;
import com.agentstudio.observability.run.RunPaths;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * The shared session key file that lets invocations lacking a direct session id converge on
 * the key a sibling invocation saw. Expiry is sliding: every successful read pushes it out.
 *
 * @author Agent Studio 2025-2026
 */
public class SharedSessionKeyStore {

    private static final Logger log = LoggerFactory.getLogger(SharedSessionKeyStore.class);

    private final RunPaths paths;
    private final ObjectMapper objectMapper;
    private final Duration ttl;
    private final Clock clock;

    public SharedSessionKeyStore(RunPaths paths, ObjectMapper objectMapper, Duration ttl, Clock clock) {
        this.paths = paths;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Shared key file content.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SharedSessionKey(
            @JsonProperty("session_key") String sessionKey,
            @JsonProperty("created_at") String createdAt,
            @JsonProperty("expires_at") String expiresAt,
            @JsonProperty("created_by") String createdBy,
            @JsonProperty("refreshed_at") String refreshedAt) {
    }

    /**
     * Returns the shared key when present and not expired, refreshing its expiry.
     */
    public Optional<String> readAndRefresh() {
        Optional<SharedSessionKey> current = readValid();
        if (current.isEmpty()) {
            return Optional.empty();
        }
        SharedSessionKey key = current.get();
        Instant now = Instant.now(clock);
        write(new SharedSessionKey(key.sessionKey(), key.createdAt(), now.plus(ttl).toString(),
                key.createdBy(), now.toString()));
        return Optional.of(key.sessionKey());
    }

    /**
     * Persists {@code sessionKey} as the shared key. An unexpired file holding the same key is
     * only refreshed, keeping its creation metadata.
     *
     * @param createdBy where the key came from (payload, env)
     */
    public void persist(String sessionKey, String createdBy) {
        if (sessionKey == null) {
            return;
        }
        Instant now = Instant.now(clock);
        Optional<SharedSessionKey> current = readValid();
        SharedSessionKey next;
        if (current.isPresent() && sessionKey.equals(current.get().sessionKey())) {
            SharedSessionKey key = current.get();
            next = new SharedSessionKey(sessionKey, key.createdAt(), now.plus(ttl).toString(),
                    key.createdBy(), now.toString());
        } else {
            next = new SharedSessionKey(sessionKey, now.toString(), now.plus(ttl).toString(), createdBy, now.toString());
        }
        write(next);
    }

    /**
     * Reads the file without refreshing it.
     */
    public Optional<SharedSessionKey> read() {
        Path path = paths.sharedSessionKeyPath();
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(path.toFile(), SharedSessionKey.class));
        } catch (IOException e) {
            log.debug("Unreadable shared session key {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<SharedSessionKey> readValid() {
        return read().filter(key -> SessionKeys.normalize(key.sessionKey()) != null)
                .filter(key -> !isExpired(key, Instant.now(clock)));
    }

    private boolean isExpired(SharedSessionKey key, Instant now) {
        if (key.expiresAt() == null) {
            return true;
        }
        try {
            return !Instant.parse(key.expiresAt()).isAfter(now);
        } catch (DateTimeParseException e) {
            log.debug("Invalid expires_at in shared session key: {}", key.expiresAt());
            return true;
        }
    }

    private void write(SharedSessionKey key) {
        Path path = paths.sharedSessionKeyPath();
        try {
            AtomicFiles.write(path, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(key));
        } catch (IOException e) {
            log.debug("Unable to write shared session key {}: {}", path, e.getMessage());
        }
    }
}
