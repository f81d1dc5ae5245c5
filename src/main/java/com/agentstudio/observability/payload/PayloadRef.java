package com.agentstudio.observability.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pointer from an event to its stored payload.
 *
 * @param payloadRef      absolute path of the stored payload file
 * @param inputsRedacted  whether secrets were removed from the inputs
 * @param outputsRedacted whether secrets were removed from the outputs
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PayloadRef(
        @JsonProperty("payload_ref") String payloadRef,
        @JsonProperty("inputs_redacted") boolean inputsRedacted,
        @JsonProperty("outputs_redacted") boolean outputsRedacted) {
}
