package com.agentstudio.observability.event;

import com.agentstudio.observability.run.AtomicFiles;
import com.agentstudio.observability.run.RunPaths;
import com.agentstudio.observability.run.RunState;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * {@code last-run.json}: pointer to the most recently touched run, for status lines and reports.
 */
public class LastRunPointer {

    private static final Logger log = LoggerFactory.getLogger(LastRunPointer.class);

    private final RunPaths paths;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public LastRunPointer(RunPaths paths, ObjectMapper objectMapper, Clock clock) {
        this.paths = paths;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LastRun(
            @JsonProperty("run_id") String runId,
            @JsonProperty("session_key") String sessionKey,
            @JsonProperty("status") String status,
            @JsonProperty("current_agent") String currentAgent,
            @JsonProperty("current_activity") String currentActivity,
            @JsonProperty("updated_at") String updatedAt) {
    }

    public void update(RunState state) {
        Path path = paths.lastRunPath();
        LastRun pointer = new LastRun(state.getRunId(), state.getSessionKey(),
                state.getStatus() == null ? null : state.getStatus().value(),
                state.getCurrentAgent(), state.getCurrentActivity(), Instant.now(clock).toString());
        try {
            AtomicFiles.write(path, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(pointer));
        } catch (IOException e) {
            log.debug("Unable to update {}: {}", path, e.getMessage());
        }
    }

    public Optional<LastRun> read() {
        Path path = paths.lastRunPath();
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(path.toFile(), LastRun.class));
        } catch (IOException e) {
            log.debug("Unreadable {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
