package com.agentstudio.observability.delegation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A Task handoff waiting for its subagent to start.
 *
 * @param agent  delegated (target) agent
 * @param parent agent that issued the handoff
 * @param ts     enqueue time, epoch millis
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PendingDelegation(
        @JsonProperty("agent") String agent,
        @JsonProperty("parent") String parent,
        @JsonProperty("ts") long ts) {
}
