package com.agentstudio.observability.hook;

import com.agentstudio.observability.event.RunEvent;

/**
 * What one invocation did.
 *
 * @param outcome    how the invocation ended
 * @param runId      the run, null when nothing was recorded
 * @param sessionKey the session, null when nothing was recorded
 * @param event      the emitted event, null when nothing was recorded
 */
public record InvocationResult(Outcome outcome, String runId, String sessionKey, RunEvent event) {

    public enum Outcome {
        /** Run document committed and event emitted. */
        RECORDED,
        /** Event emitted but the run document could not be written. */
        DEGRADED,
        /** Observer disabled by configuration. */
        DISABLED,
        /** Nested inside another observer invocation. */
        NESTED,
        /** Failed before an event could be emitted. */
        FAILED
    }

    static InvocationResult skipped(Outcome outcome) {
        return new InvocationResult(outcome, null, null, null);
    }

    public boolean recorded() {
        return event != null;
    }
}
