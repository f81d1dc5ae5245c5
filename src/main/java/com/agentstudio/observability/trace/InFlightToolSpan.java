package com.agentstudio.observability.trace;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tool span opened by a pre event and awaiting its post event.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InFlightToolSpan(
        @JsonProperty("agent") String agent,
        @JsonProperty("tool") String tool,
        @JsonProperty("span_id") String spanId,
        @JsonProperty("parent_span_id") String parentSpanId,
        @JsonProperty("started_at") String startedAt) {

    boolean matches(String otherAgent, String otherTool) {
        return agent != null && agent.equals(otherAgent) && tool != null && tool.equals(otherTool);
    }
}
