package com.agentstudio.observability.failure;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;

/**
 * Input of {@link FailureBundleGenerator#generate(FailureBundleRequest)}.
 * <p>
 * Run-scoped requests locate the event log, tool-events stream and state document from the
 * run id. Headless requests (no run) pass the log paths explicitly.
 *
 * @param traceId        trace of the failing span
 * @param spanId         failing span
 * @param runId          run id, null for headless use
 * @param sessionKey     session key, may be null
 * @param failureType    short classification, e.g. {@code tool_error}
 * @param triggerEvent   the event that exposed the failure, may be null
 * @param eventsPath     explicit event log, overrides the run's
 * @param toolEventsPath explicit tool-events stream, overrides the run's
 */
public record FailureBundleRequest(
        String traceId,
        String spanId,
        String runId,
        String sessionKey,
        String failureType,
        JsonNode triggerEvent,
        Path eventsPath,
        Path toolEventsPath) {

    public static FailureBundleRequest forRun(String traceId, String spanId, String runId, String sessionKey,
                                              String failureType, JsonNode triggerEvent) {
        return new FailureBundleRequest(traceId, spanId, runId, sessionKey, failureType, triggerEvent, null, null);
    }

    public static FailureBundleRequest headless(String traceId, String spanId, String failureType,
                                                Path eventsPath, Path toolEventsPath) {
        return new FailureBundleRequest(traceId, spanId, null, null, failureType, null, eventsPath, toolEventsPath);
    }
}
