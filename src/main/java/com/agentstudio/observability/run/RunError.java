package com.agentstudio.observability.run;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Application-level failure observed in a tool result, recorded as data.
 *
 * @param at      ISO-8601 timestamp
 * @param agent   agent that ran the tool
 * @param tool    tool name
 * @param message truncated failure message
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunError(
        @JsonProperty("at") String at,
        @JsonProperty("agent") String agent,
        @JsonProperty("tool") String tool,
        @JsonProperty("message") String message) {
}
