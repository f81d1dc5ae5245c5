package com.agentstudio.observability.event;

import com.agentstudio.observability.payload.SecretRedactor;
import com.agentstudio.observability.run.AtomicFiles;
import com.agentstudio.observability.run.RunPaths;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Writes one {@code agent_task_completion} artifact per completed Task handoff, grouped by session.
 */
public class AgentTaskArtifactWriter {

    private static final Logger log = LoggerFactory.getLogger(AgentTaskArtifactWriter.class);

    public static final String ARTIFACT_TYPE = "agent_task_completion";

    static final int RESULT_PREVIEW_CHARS = 2000;

    private final RunPaths paths;
    private final ObjectMapper objectMapper;
    private final SecretRedactor redactor;
    private final Clock clock;

    public AgentTaskArtifactWriter(RunPaths paths, ObjectMapper objectMapper, SecretRedactor redactor, Clock clock) {
        this.paths = paths;
        this.objectMapper = objectMapper;
        this.redactor = redactor;
        this.clock = clock;
    }

    /**
     * Writes the artifact for a completed Task event.
     *
     * @param toolResult the Task result, may be null
     * @return the artifact path, empty when the channel is disabled or the write failed
     */
    public Optional<Path> write(RunEvent event, JsonNode toolResult) {
        Path dir = paths.agentTaskArtifactsDir(event.getSessionKey());
        if (dir == null) {
            return Optional.empty();
        }
        Instant now = Instant.now(clock);
        String delegated = event.getDelegatedAgent() == null ? "unknown" : event.getDelegatedAgent();
        Path path = dir.resolve(now.toEpochMilli() + "-" + delegated.replaceAll("[^A-Za-z0-9_-]+", "_") + ".json");

        ObjectNode artifact = objectMapper.createObjectNode();
        artifact.put("artifact_type", ARTIFACT_TYPE);
        artifact.put("run_id", event.getRunId());
        artifact.put("session_key", event.getSessionKey());
        artifact.put("agent", event.getAgent());
        artifact.put("delegated_agent", event.getDelegatedAgent());
        artifact.put("completed_at", now.toString());
        artifact.put("ok", event.isOk());
        artifact.put("trace_id", event.getTraceId());
        artifact.put("span_id", event.getSpanId());
        if (event.getDurationMs() != null) {
            artifact.put("duration_ms", event.getDurationMs());
        }
        if (event.getError() != null) {
            artifact.put("error", event.getError());
        }
        if (toolResult != null && !toolResult.isNull()) {
            String text = redactor.redact(toolResult.isTextual() ? toolResult.asText() : toolResult.toString()).value();
            artifact.put("result_preview", text.length() > RESULT_PREVIEW_CHARS
                    ? text.substring(0, RESULT_PREVIEW_CHARS) : text);
        }
        try {
            AtomicFiles.write(path, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(artifact));
            return Optional.of(path);
        } catch (IOException e) {
            log.debug("Unable to write agent task artifact {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
