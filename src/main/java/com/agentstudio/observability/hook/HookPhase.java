package com.agentstudio.observability.hook;

import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle point at which the host invoked the observer.
 *
 * @author Agent Studio 2025-2026
 */
public enum HookPhase {

    PRE("pre", "pretooluse"),
    POST("post", "posttooluse"),
    SUBAGENT_START("subagent-start", "subagentstart"),
    SUBAGENT_STOP("subagent-stop", "subagentstop"),
    SESSION_START("session-start", "sessionstart"),
    STOP("stop", "stop"),
    SESSION_END("session-end", "sessionend");

    private final String value;
    private final String hostEventName;

    HookPhase(String value, String hostEventName) {
        this.value = value;
        this.hostEventName = hostEventName;
    }

    /** Command-line spelling, also written as the event's {@code phase}. */
    public String value() {
        return value;
    }

    /**
     * Parses a phase argument. Accepts the command-line spelling, the host's event names
     * ({@code PreToolUse}, {@code SubagentStop}...) and underscores in place of dashes.
     */
    public static Optional<HookPhase> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String candidate = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        String compact = candidate.replace("-", "");
        for (HookPhase phase : values()) {
            if (phase.value.equals(candidate) || phase.hostEventName.equals(compact)) {
                return Optional.of(phase);
            }
        }
        return Optional.empty();
    }

    /** Phases answered with an explicit approval. */
    public boolean isGate() {
        return this == PRE;
    }

    /** Phases that complete the run. */
    public boolean isTerminal() {
        return this == STOP || this == SESSION_END;
    }

    public boolean isToolPhase() {
        return this == PRE || this == POST;
    }
}
