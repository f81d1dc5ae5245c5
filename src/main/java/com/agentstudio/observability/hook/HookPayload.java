package com.agentstudio.observability.hook;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Normalized view of a hook payload. Field-name aliases are resolved by
 * {@link HookPayloadReader}; nothing downstream looks at raw payload shapes.
 *
 * @param toolName       tool being called, null for lifecycle phases
 * @param toolInput      tool arguments, null when absent
 * @param toolResult     tool result (post phase), null when absent
 * @param context        free-form hint bag, null when absent
 * @param sessionId      raw session id found in the payload or its context
 * @param agentName      calling (or starting) agent named by the payload
 * @param delegatedAgent target agent of a Task call
 * @param filePath       file touched by a file tool
 * @param degraded       true when the payload was only partially recovered
 */
public record HookPayload(
        String toolName,
        JsonNode toolInput,
        JsonNode toolResult,
        JsonNode context,
        String sessionId,
        String agentName,
        String delegatedAgent,
        String filePath,
        boolean degraded) {

    public static HookPayload empty() {
        return new HookPayload(null, null, null, null, null, null, null, null, false);
    }

    public boolean hasTool() {
        return toolName != null && !toolName.isBlank();
    }
}
