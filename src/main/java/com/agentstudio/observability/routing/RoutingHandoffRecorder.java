package com.agentstudio.observability.routing;

import com.agentstudio.observability.event.ToolEventsMirror;
import com.agentstudio.observability.run.AtomicFiles;
import com.agentstudio.observability.run.RunPaths;
import com.agentstudio.observability.run.RunState;
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
 * Records how a routing handoff was carried out: {@code proactive} when the orchestrator
 * spawned the routed target on its own, {@code fallback} when an enforcement hook first had to
 * deny a Task with the handoff-required marker.
 *
 * @author Agent Studio 2025-2026
 */
public class RoutingHandoffRecorder {

    private static final Logger log = LoggerFactory.getLogger(RoutingHandoffRecorder.class);

    public static final String HANDOFF_REQUIRED_MARKER = "ROUTING HANDOFF REQUIRED";
    public static final String OUTCOME_PROACTIVE = "proactive";
    public static final String OUTCOME_FALLBACK = "fallback";

    private final RunPaths paths;
    private final ToolEventsMirror toolEvents;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RoutingHandoffRecorder(RunPaths paths, ToolEventsMirror toolEvents, ObjectMapper objectMapper,
                                  Clock clock) {
        this.paths = paths;
        this.toolEvents = toolEvents;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Marks the handoff completed when a finished Task delegated to the routed target.
     *
     * @return the outcome when this call completed the handoff
     */
    public Optional<String> onTaskCompleted(RunState state, String delegatedAgent) {
        RoutingState routing = state.getRouting();
        String target = routing.getHandoffTarget();
        if (target == null || delegatedAgent == null || routing.isHandoffCompleted()
                || !target.equalsIgnoreCase(delegatedAgent)) {
            return Optional.empty();
        }
        String outcome = toolEvents.containsDeniedTask(state.getRunId(), HANDOFF_REQUIRED_MARKER)
                ? OUTCOME_FALLBACK : OUTCOME_PROACTIVE;
        routing.setHandoffCompleted(true);
        routing.setHandoffOutcome(outcome);
        return Optional.of(outcome);
    }

    /**
     * Writes {@code run-<run_id>.json} into the handoff artifacts directory, when configured.
     */
    public void writeArtifact(RunState state, String sessionKey) {
        Path path = paths.routingHandoffArtifactPath(state.getRunId());
        RoutingState routing = state.getRouting();
        if (path == null || routing.getHandoffOutcome() == null) {
            return;
        }
        ObjectNode artifact = objectMapper.createObjectNode();
        artifact.put("run_id", state.getRunId());
        artifact.put("session_key", sessionKey);
        artifact.put("handoff_target", routing.getHandoffTarget());
        artifact.put("outcome", routing.getHandoffOutcome());
        artifact.put("recorded_at", Instant.now(clock).toString());
        if (routing.getDecision() != null) {
            artifact.set("routing_decision", routing.getDecision());
        }
        try {
            AtomicFiles.write(path, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(artifact));
        } catch (IOException e) {
            log.debug("Unable to write routing handoff artifact {}: {}", path, e.getMessage());
        }
    }
}
