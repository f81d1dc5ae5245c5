package com.agentstudio.observability.run;

import com.agentstudio.observability.delegation.PendingDelegation;
import com.agentstudio.observability.metrics.RunMetrics;
import com.agentstudio.observability.routing.RoutingState;
import com.agentstudio.observability.trace.RunTrace;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The durable run document ({@code runs/<run_id>/state.json}).
 * <p>
 * Every invocation reads it fully, mutates it and writes it back atomically. Fields this
 * class does not know about (written by other tools) are kept and written back unchanged.
 *
 * @author Agent Studio 2025-2026
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"run_id", "session_key", "status", "current_agent", "current_activity", "current_step",
        "started_at", "last_heartbeat_at", "last_event_at", "events_count", "revision"})
public class RunState {

    private String runId;
    private String sessionKey;
    private RunStatus status = RunStatus.RUNNING;
    private String currentAgent;
    private String currentActivity;
    private int currentStep;
    private String startedAt;
    private String lastHeartbeatAt;
    private String lastEventAt;
    private long eventsCount;
    private long revision;
    private List<RunError> errors = new ArrayList<>();
    private RunMetrics metrics = new RunMetrics();
    private RunTrace trace = new RunTrace();
    private RoutingState routing = new RoutingState();
    private List<PendingDelegation> pendingSubagents = new ArrayList<>();
    private List<String> subagentParentStack = new ArrayList<>();

    private final Map<String, Object> additionalFields = new LinkedHashMap<>();

    /**
     * Synthesizes the document used when no prior state exists.
     *
     * @param runId      the run id
     * @param sessionKey the session key owning the run
     * @param now        ISO-8601 creation time
     * @return a fresh running document
     */
    public static RunState createDefault(String runId, String sessionKey, String now) {
        RunState state = new RunState();
        state.setRunId(runId);
        state.setSessionKey(sessionKey);
        state.setStartedAt(now);
        state.setLastHeartbeatAt(now);
        return state;
    }

    /**
     * Appends an application-level error, dropping the oldest entries beyond {@code maxErrors},
     * and marks the run failed.
     */
    public void recordError(RunError error, int maxErrors) {
        List<RunError> list = getErrors();
        list.add(error);
        while (list.size() > Math.max(1, maxErrors)) {
            list.remove(0);
        }
        status = RunStatus.FAILED;
    }

    /**
     * Terminal phases complete the run unless it already failed.
     */
    public void markCompleted() {
        if (status != RunStatus.FAILED) {
            status = RunStatus.COMPLETED;
        }
    }

    /**
     * Non-terminal activity re-opens a completed run (a resumed session); failed stays failed.
     */
    public void markActive() {
        if (status == null || status == RunStatus.COMPLETED) {
            status = RunStatus.RUNNING;
        }
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public String getSessionKey() {
        return sessionKey;
    }

    public void setSessionKey(String sessionKey) {
        this.sessionKey = sessionKey;
    }

    public RunStatus getStatus() {
        return status;
    }

    public void setStatus(RunStatus status) {
        this.status = status;
    }

    public String getCurrentAgent() {
        return currentAgent;
    }

    public void setCurrentAgent(String currentAgent) {
        this.currentAgent = currentAgent;
    }

    public String getCurrentActivity() {
        return currentActivity;
    }

    public void setCurrentActivity(String currentActivity) {
        this.currentActivity = currentActivity;
    }

    public int getCurrentStep() {
        return currentStep;
    }

    public void setCurrentStep(int currentStep) {
        this.currentStep = currentStep;
    }

    public String getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(String startedAt) {
        this.startedAt = startedAt;
    }

    public String getLastHeartbeatAt() {
        return lastHeartbeatAt;
    }

    public void setLastHeartbeatAt(String lastHeartbeatAt) {
        this.lastHeartbeatAt = lastHeartbeatAt;
    }

    public String getLastEventAt() {
        return lastEventAt;
    }

    public void setLastEventAt(String lastEventAt) {
        this.lastEventAt = lastEventAt;
    }

    public long getEventsCount() {
        return eventsCount;
    }

    public void setEventsCount(long eventsCount) {
        this.eventsCount = eventsCount;
    }

    public long getRevision() {
        return revision;
    }

    public void setRevision(long revision) {
        this.revision = revision;
    }

    public List<RunError> getErrors() {
        if (errors == null) {
            errors = new ArrayList<>();
        }
        return errors;
    }

    public void setErrors(List<RunError> errors) {
        this.errors = errors;
    }

    public RunMetrics getMetrics() {
        if (metrics == null) {
            metrics = new RunMetrics();
        }
        return metrics;
    }

    public void setMetrics(RunMetrics metrics) {
        this.metrics = metrics;
    }

    public RunTrace getTrace() {
        if (trace == null) {
            trace = new RunTrace();
        }
        return trace;
    }

    public void setTrace(RunTrace trace) {
        this.trace = trace;
    }

    public RoutingState getRouting() {
        if (routing == null) {
            routing = new RoutingState();
        }
        return routing;
    }

    public void setRouting(RoutingState routing) {
        this.routing = routing;
    }

    public List<PendingDelegation> getPendingSubagents() {
        if (pendingSubagents == null) {
            pendingSubagents = new ArrayList<>();
        }
        return pendingSubagents;
    }

    public void setPendingSubagents(List<PendingDelegation> pendingSubagents) {
        this.pendingSubagents = pendingSubagents;
    }

    public List<String> getSubagentParentStack() {
        if (subagentParentStack == null) {
            subagentParentStack = new ArrayList<>();
        }
        return subagentParentStack;
    }

    public void setSubagentParentStack(List<String> subagentParentStack) {
        this.subagentParentStack = subagentParentStack;
    }

    @JsonAnyGetter
    public Map<String, Object> getAdditionalFields() {
        return additionalFields;
    }

    @JsonAnySetter
    public void setAdditionalField(String name, Object value) {
        additionalFields.put(name, value);
    }
}
