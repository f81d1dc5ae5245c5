package com.agentstudio.observability.event;

import com.agentstudio.observability.RunObserverProperties;
import com.agentstudio.observability.run.RunPaths;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Append-only {@code events.ndjson} of a run, with sampled size-based rotation to a single
 * {@code .1} backup. Failures are logged and dropped.
 *
 * @author Agent Studio 2025-2026
 */
public class EventLog {

    private static final Logger log = LoggerFactory.getLogger(EventLog.class);

    public static final String BACKUP_SUFFIX = ".1";

    private final RunPaths paths;
    private final ObjectMapper objectMapper;
    private final RunObserverProperties.Events config;

    public EventLog(RunPaths paths, ObjectMapper objectMapper, RunObserverProperties.Events config) {
        this.paths = paths;
        this.objectMapper = objectMapper;
        this.config = config;
    }

    /**
     * Appends one event. On every Nth event (by the run's event count) the log is first
     * rotated when it exceeds the byte threshold, so this event starts the fresh log.
     *
     * @param eventsCount the run's event count including this event
     * @return true when the line was written
     */
    public boolean append(String runId, RunEvent event, long eventsCount) {
        Path path = paths.eventsPath(runId);
        if (isRotationCheck(eventsCount)) {
            rotateIfNeeded(path);
        }
        try {
            NdjsonFiles.appendLine(path, objectMapper.writeValueAsBytes(event));
            return true;
        } catch (IOException e) {
            log.debug("Unable to append event to {}: {}", path, e.getMessage());
            return false;
        }
    }

    boolean isRotationCheck(long eventsCount) {
        int every = Math.max(1, config.getRotateEvery());
        return eventsCount > 0 && eventsCount % every == 0;
    }

    /**
     * Renames the log to its {@code .1} backup, replacing any previous backup, when it exceeds
     * the byte threshold.
     *
     * @return true when the log was rotated
     */
    public boolean rotateIfNeeded(Path path) {
        try {
            if (!Files.exists(path) || Files.size(path) <= config.getRotateBytes()) {
                return false;
            }
            Path backup = path.resolveSibling(path.getFileName() + BACKUP_SUFFIX);
            Files.move(path, backup, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Rotated event log {} to {}", path, backup);
            return true;
        } catch (IOException e) {
            log.debug("Unable to rotate event log {}: {}", path, e.getMessage());
            return false;
        }
    }
}
