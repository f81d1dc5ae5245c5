package com.agentstudio.observability.hook;

/**
 * The single line written to stdout per invocation. The observer never blocks or denies.
 *
 * @author Agent Studio 2025-2026
 */
public enum HookResponse {

    APPROVE("{\"decision\":\"approve\"}"),
    OBSERVE("{\"hookSpecificOutput\":{\"hookEventName\":\"PostToolUse\"}}");

    private final String json;

    HookResponse(String json) {
        this.json = json;
    }

    public String json() {
        return json;
    }

    /**
     * Response for a phase; an unknown phase gets the observational response.
     */
    public static HookResponse forPhase(HookPhase phase) {
        return phase != null && phase.isGate() ? APPROVE : OBSERVE;
    }
}
