package com.agentstudio.observability.routing;

import com.agentstudio.observability.run.RunPaths;
import com.agentstudio.observability.run.RunState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Ingests the routing subsystem's per-session decision file
 * ({@code <hook-tmp>/routing-sessions/<safe-id>.json}). Decisions are only copied into the
 * run document, never computed or written back.
 *
 * @author Agent Studio 2025-2026
 */
public class RoutingDecisionReader {

    private static final Logger log = LoggerFactory.getLogger(RoutingDecisionReader.class);

    private final RunPaths paths;
    private final ObjectMapper objectMapper;

    public RoutingDecisionReader(RunPaths paths, ObjectMapper objectMapper) {
        this.paths = paths;
        this.objectMapper = objectMapper;
    }

    /**
     * Reads the routing section for a session, empty when absent or unreadable.
     */
    public Optional<RoutingState> read(String sessionKey) {
        Path path = paths.routingSessionPath(sessionKey);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            JsonNode routing = objectMapper.readTree(path.toFile()).path("routing");
            if (!routing.isObject()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.treeToValue(routing, RoutingState.class));
        } catch (IOException e) {
            log.debug("Unreadable routing decision {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Copies an ingested decision into the run. The locally observed handoff outcome is kept,
     * and a handoff completed here is not reset by a stale upstream file.
     */
    public static void merge(RunState state, RoutingState ingested) {
        RoutingState routing = state.getRouting();
        routing.setCompleted(ingested.isCompleted());
        if (ingested.getCompletedAt() != null) {
            routing.setCompletedAt(ingested.getCompletedAt());
        }
        if (ingested.getDecision() != null && !ingested.getDecision().isNull()) {
            routing.setDecision(ingested.getDecision());
        }
        if (ingested.getHandoffTarget() != null) {
            routing.setHandoffTarget(ingested.getHandoffTarget());
        }
        routing.setHandoffCompleted(routing.isHandoffCompleted() || ingested.isHandoffCompleted());
    }
}
