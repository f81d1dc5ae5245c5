package com.agentstudio.observability.event;

import com.agentstudio.observability.payload.PayloadRef;
import com.agentstudio.observability.trace.SpanKind;
import com.agentstudio.observability.trace.TraceEventType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One line of {@code events.ndjson}: the observed transition of a single invocation.
 *
 * @author Agent Studio 2025-2026
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"ts", "trace_id", "span_id", "parent_span_id", "traceparent", "span_kind", "event_type",
        "phase", "run_id", "session_key", "agent", "tool", "activity", "ok"})
public class RunEvent {

    private String ts;
    private String traceId;
    private String spanId;
    private String parentSpanId;
    private String traceparent;
    private Map<String, String> baggage = new LinkedHashMap<>();
    private SpanKind spanKind;
    private TraceEventType eventType;
    private String phase;
    private String runId;
    private String sessionKey;
    private String agent;
    private String tool;
    private String activity;
    private boolean ok = true;
    private Long durationMs;
    private String error;
    private String delegatedAgent;
    private PayloadRef payload;
    private String failureBundle;

    public String getTs() {
        return ts;
    }

    public void setTs(String ts) {
        this.ts = ts;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getSpanId() {
        return spanId;
    }

    public void setSpanId(String spanId) {
        this.spanId = spanId;
    }

    public String getParentSpanId() {
        return parentSpanId;
    }

    public void setParentSpanId(String parentSpanId) {
        this.parentSpanId = parentSpanId;
    }

    public String getTraceparent() {
        return traceparent;
    }

    public void setTraceparent(String traceparent) {
        this.traceparent = traceparent;
    }

    public Map<String, String> getBaggage() {
        return baggage;
    }

    public void setBaggage(Map<String, String> baggage) {
        this.baggage = baggage;
    }

    public SpanKind getSpanKind() {
        return spanKind;
    }

    public void setSpanKind(SpanKind spanKind) {
        this.spanKind = spanKind;
    }

    public TraceEventType getEventType() {
        return eventType;
    }

    public void setEventType(TraceEventType eventType) {
        this.eventType = eventType;
    }

    public String getPhase() {
        return phase;
    }

    public void setPhase(String phase) {
        this.phase = phase;
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

    public String getAgent() {
        return agent;
    }

    public void setAgent(String agent) {
        this.agent = agent;
    }

    public String getTool() {
        return tool;
    }

    public void setTool(String tool) {
        this.tool = tool;
    }

    public String getActivity() {
        return activity;
    }

    public void setActivity(String activity) {
        this.activity = activity;
    }

    public boolean isOk() {
        return ok;
    }

    public void setOk(boolean ok) {
        this.ok = ok;
    }

    public Long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(Long durationMs) {
        this.durationMs = durationMs;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getDelegatedAgent() {
        return delegatedAgent;
    }

    public void setDelegatedAgent(String delegatedAgent) {
        this.delegatedAgent = delegatedAgent;
    }

    public PayloadRef getPayload() {
        return payload;
    }

    public void setPayload(PayloadRef payload) {
        this.payload = payload;
    }

    public String getFailureBundle() {
        return failureBundle;
    }

    public void setFailureBundle(String failureBundle) {
        this.failureBundle = failureBundle;
    }
}
