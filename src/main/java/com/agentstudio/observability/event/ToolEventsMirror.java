package com.agentstudio.observability.event;

import com.agentstudio.observability.run.RunPaths;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Per-run tool-events stream shared with the external audit subsystem
 * ({@code <tool-events-dir>/run-<run_id>.ndjson}). Enforcement hooks append their own denial
 * records to the same stream.
 *
 * @author Agent Studio 2025-2026
 */
public class ToolEventsMirror {

    private static final Logger log = LoggerFactory.getLogger(ToolEventsMirror.class);

    /** Denials are looked for in the most recent part of the stream only. */
    static final int DENIAL_SCAN_LINES = 500;
    static final int DENIAL_SCAN_BYTES = 256 * 1024;

    private final RunPaths paths;
    private final ObjectMapper objectMapper;

    public ToolEventsMirror(RunPaths paths, ObjectMapper objectMapper) {
        this.paths = paths;
        this.objectMapper = objectMapper;
    }

    /**
     * Mirrors a tool event. Lifecycle events without a tool are not mirrored.
     */
    public void append(RunEvent event) {
        Path path = paths.toolEventsPath(event.getRunId());
        if (path == null || event.getTool() == null) {
            return;
        }
        ObjectNode line = objectMapper.createObjectNode();
        line.put("ts", event.getTs());
        line.put("run_id", event.getRunId());
        line.put("session_key", event.getSessionKey());
        line.put("phase", event.getPhase());
        line.put("tool", event.getTool());
        line.put("agent", event.getAgent());
        line.put("ok", event.isOk());
        line.put("denied", false);
        line.put("trace_id", event.getTraceId());
        line.put("span_id", event.getSpanId());
        if (event.getDurationMs() != null) {
            line.put("duration_ms", event.getDurationMs());
        }
        if (event.getDelegatedAgent() != null) {
            line.put("delegated_agent", event.getDelegatedAgent());
        }
        if (event.getError() != null) {
            line.put("error", event.getError());
        }
        try {
            NdjsonFiles.appendLine(path, objectMapper.writeValueAsBytes(line));
        } catch (IOException e) {
            log.debug("Unable to mirror tool event to {}: {}", path, e.getMessage());
        }
    }

    /**
     * Whether the recent tail of the stream holds a denied Task call carrying {@code marker}
     * in its denial reason.
     */
    public boolean containsDeniedTask(String runId, String marker) {
        Path path = paths.toolEventsPath(runId);
        if (path == null || !Files.exists(path)) {
            return false;
        }
        String needle = marker.toLowerCase(Locale.ROOT);
        try {
            List<String> lines = NdjsonFiles.tail(path, DENIAL_SCAN_LINES, DENIAL_SCAN_BYTES);
            for (String line : lines) {
                if (line.isBlank() || !line.toLowerCase(Locale.ROOT).contains(needle)) {
                    continue;
                }
                JsonNode node = parse(line);
                if (node != null && node.path("denied").asBoolean(false)
                        && "Task".equals(node.path("tool").asText())
                        && node.toString().toLowerCase(Locale.ROOT).contains(needle)) {
                    return true;
                }
            }
        } catch (IOException e) {
            log.debug("Unable to read tool events {}: {}", path, e.getMessage());
        }
        return false;
    }

    private JsonNode parse(String line) {
        try {
            return objectMapper.readTree(line);
        } catch (IOException e) {
            log.debug("Skipping malformed tool event line: {}", e.getMessage());
            return null;
        }
    }
}
