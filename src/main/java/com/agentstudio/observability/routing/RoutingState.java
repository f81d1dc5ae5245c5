package com.agentstudio.observability.routing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Routing decision as ingested from the routing subsystem, plus the handoff outcome
 * observed by this engine.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RoutingState {

    private boolean completed;
    private String completedAt;
    private JsonNode decision;
    private String handoffTarget;
    private boolean handoffCompleted;
    private String handoffOutcome;

    public boolean isCompleted() {
        return completed;
    }

    public void setCompleted(boolean completed) {
        this.completed = completed;
    }

    public String getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(String completedAt) {
        this.completedAt = completedAt;
    }

    public JsonNode getDecision() {
        return decision;
    }

    public void setDecision(JsonNode decision) {
        this.decision = decision;
    }

    public String getHandoffTarget() {
        return handoffTarget;
    }

    public void setHandoffTarget(String handoffTarget) {
        this.handoffTarget = handoffTarget;
    }

    public boolean isHandoffCompleted() {
        return handoffCompleted;
    }

    public void setHandoffCompleted(boolean handoffCompleted) {
        this.handoffCompleted = handoffCompleted;
    }

    public String getHandoffOutcome() {
        return handoffOutcome;
    }

    public void setHandoffOutcome(String handoffOutcome) {
        this.handoffOutcome = handoffOutcome;
    }
}
