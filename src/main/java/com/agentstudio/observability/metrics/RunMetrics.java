package com.agentstudio.observability.metrics;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metrics section of the run document: tool- and agent-keyed rollups plus the
 * per-(agent, tool) queues of start timestamps awaiting their post event.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RunMetrics {

    private Map<String, MetricsEntry> tools = new LinkedHashMap<>();
    private Map<String, MetricsEntry> agents = new LinkedHashMap<>();
    private Map<String, List<Long>> inFlight = new LinkedHashMap<>();

    public Map<String, MetricsEntry> getTools() {
        if (tools == null) {
            tools = new LinkedHashMap<>();
        }
        return tools;
    }

    public void setTools(Map<String, MetricsEntry> tools) {
        this.tools = tools;
    }

    public Map<String, MetricsEntry> getAgents() {
        if (agents == null) {
            agents = new LinkedHashMap<>();
        }
        return agents;
    }

    public void setAgents(Map<String, MetricsEntry> agents) {
        this.agents = agents;
    }

    public Map<String, List<Long>> getInFlight() {
        if (inFlight == null) {
            inFlight = new LinkedHashMap<>();
        }
        return inFlight;
    }

    public void setInFlight(Map<String, List<Long>> inFlight) {
        this.inFlight = inFlight;
    }

    List<Long> startQueue(String key) {
        return getInFlight().computeIfAbsent(key, k -> new ArrayList<>());
    }
}
