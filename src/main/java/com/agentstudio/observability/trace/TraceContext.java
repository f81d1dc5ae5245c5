package com.agentstudio.observability.trace;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * W3C-shaped trace context of one span.
 *
 * @param traceId      32 lowercase hex chars, stable for the run
 * @param spanId       16 lowercase hex chars
 * @param parentSpanId parent span, or null for a root
 * @param baggage      propagated key/values (session, run, agent, workflow)
 * @param sampled      sampling decision taken at root creation
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TraceContext(
        @JsonProperty("trace_id") String traceId,
        @JsonProperty("span_id") String spanId,
        @JsonProperty("parent_span_id") String parentSpanId,
        @JsonProperty("baggage") Map<String, String> baggage,
        @JsonProperty("sampled") boolean sampled) {

    public TraceContext {
        baggage = baggage == null ? new LinkedHashMap<>() : new LinkedHashMap<>(baggage);
    }

    /** {@code 00-<trace_id>-<span_id>-<flags>} for this span. */
    public String traceparent() {
        return TraceIds.traceparent(traceId, spanId, sampled);
    }
}
