package com.agentstudio.observability.failure;

import com.agentstudio.observability.event.NdjsonFiles;
import com.agentstudio.observability.payload.SecretRedactor;
import com.agentstudio.observability.run.AtomicFiles;
import com.agentstudio.observability.run.RunPaths;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;

/**
 * Writes failure bundles as JSON files: references to the run's logs, redacted tails of the
 * event log and tool-events stream, and a snapshot of the run document.
 *
 * @author Agent Studio 2025-2026
 */
public class FileFailureBundleGenerator implements FailureBundleGenerator {

    private static final Logger log = LoggerFactory.getLogger(FileFailureBundleGenerator.class);

    private static final DateTimeFormatter BUNDLE_TIME =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);

    private final RunPaths paths;
    private final Path bundlesDir;
    private final int tailLines;
    private final int tailBytes;
    private final SecretRedactor redactor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FileFailureBundleGenerator(RunPaths paths, Path bundlesDir, int tailLines, int tailBytes,
                                      SecretRedactor redactor, ObjectMapper objectMapper, Clock clock) {
        this.paths = paths;
        this.bundlesDir = bundlesDir;
        this.tailLines = tailLines;
        this.tailBytes = tailBytes;
        this.redactor = redactor;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public FailureBundleResult generate(FailureBundleRequest request) throws IOException {
        Instant now = Instant.now(clock);
        String bundleId = "fb-" + BUNDLE_TIME.format(now) + "-" + UUID.randomUUID().toString().substring(0, 8);

        Path eventsPath = request.eventsPath() != null ? request.eventsPath()
                : request.runId() != null ? paths.eventsPath(request.runId()) : null;
        Path toolEventsPath = request.toolEventsPath() != null ? request.toolEventsPath()
                : request.runId() != null ? paths.toolEventsPath(request.runId()) : null;
        Path statePath = request.runId() != null ? paths.statePath(request.runId()) : null;

        ObjectNode bundle = objectMapper.createObjectNode();
        bundle.put("bundle_id", bundleId);
        bundle.put("created_at", now.toString());
        bundle.put("trace_id", request.traceId());
        bundle.put("span_id", request.spanId());
        bundle.put("run_id", request.runId());
        bundle.put("session_key", request.sessionKey());
        bundle.put("failure_type", request.failureType());
        if (request.triggerEvent() != null) {
            bundle.set("trigger_event", redactor.redact(request.triggerEvent()).value());
        }

        ObjectNode refs = bundle.putObject("refs");
        refs.put("events_path", eventsPath == null ? null : eventsPath.toString());
        refs.put("tool_events_path", toolEventsPath == null ? null : toolEventsPath.toString());
        refs.put("state_path", statePath == null ? null : statePath.toString());

        ObjectNode tails = bundle.putObject("tails");
        tails.set("events_tail", tail(eventsPath));
        tails.set("tool_events_tail", tail(toolEventsPath));

        bundle.set("state_snapshot", snapshot(statePath));

        Path bundlePath = bundlesDir.resolve(bundleId + ".json");
        AtomicFiles.write(bundlePath, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(bundle));
        log.debug("Wrote failure bundle {} ({})", bundleId, request.failureType());
        return new FailureBundleResult(bundleId, bundlePath.toString());
    }

    private ArrayNode tail(Path path) {
        ArrayNode out = objectMapper.createArrayNode();
        List<String> lines;
        try {
            lines = NdjsonFiles.tail(path, tailLines, tailBytes);
        } catch (IOException e) {
            log.debug("Unable to tail {}: {}", path, e.getMessage());
            return out;
        }
        for (String line : lines) {
            out.add(redactor.redact(parseOrText(line)).value());
        }
        return out;
    }

    private JsonNode snapshot(Path statePath) {
        if (statePath == null || !Files.exists(statePath)) {
            return objectMapper.createObjectNode();
        }
        try {
            return redactor.redact(objectMapper.readTree(statePath.toFile())).value();
        } catch (IOException e) {
            log.debug("Unreadable state for bundle {}: {}", statePath, e.getMessage());
            return objectMapper.createObjectNode();
        }
    }

    private JsonNode parseOrText(String line) {
        try {
            return objectMapper.readTree(line);
        } catch (IOException e) {
            return TextNode.valueOf(line);
        }
    }
}
