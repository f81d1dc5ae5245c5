package com.agentstudio.observability.trace;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Trace section of the run document: the root span, the active agent span table
 * and the single in-flight tool record.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RunTrace {

    private TraceContext root;
    private Map<String, AgentSpan> agentSpans = new LinkedHashMap<>();
    private InFlightToolSpan inFlightTool;

    public TraceContext getRoot() {
        return root;
    }

    public void setRoot(TraceContext root) {
        this.root = root;
    }

    public Map<String, AgentSpan> getAgentSpans() {
        if (agentSpans == null) {
            agentSpans = new LinkedHashMap<>();
        }
        return agentSpans;
    }

    public void setAgentSpans(Map<String, AgentSpan> agentSpans) {
        this.agentSpans = agentSpans;
    }

    public InFlightToolSpan getInFlightTool() {
        return inFlightTool;
    }

    public void setInFlightTool(InFlightToolSpan inFlightTool) {
        this.inFlightTool = inFlightTool;
    }
}
