package com.agentstudio.observability.trace;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Frame of the persisted agent call table: the span an agent entered with.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentSpan(
        @JsonProperty("span_id") String spanId,
        @JsonProperty("parent_span_id") String parentSpanId,
        @JsonProperty("started_at") String startedAt) {
}
