package com.agentstudio.observability.observation;

import com.agentstudio.observability.hook.HookPhase;
import com.agentstudio.observability.hook.InvocationResult;
import io.micrometer.observation.Observation;

/**
 * Observation context for one hook invocation.
 * Carries the phase up front and the run, session and outcome once the invocation is done.
 *
 * @author Agent Studio 2025-2026
 */
public class InvocationObservationContext extends Observation.Context {

    /** Observation name of a hook invocation. */
    public static final String OBSERVATION_NAME = "agent.studio.hook.invocation";

    private final HookPhase phase;
    private String runId;
    private String sessionKey;
    private InvocationResult.Outcome outcome;

    public InvocationObservationContext(HookPhase phase) {
        this.phase = phase;
        setName(OBSERVATION_NAME);
        setContextualName("hook:" + phase.value());
    }

    /** Creates the context of an invocation. */
    public static InvocationObservationContext forPhase(HookPhase phase) {
        return new InvocationObservationContext(phase);
    }

    /** Records the invocation's result. */
    public void complete(InvocationResult result) {
        this.outcome = result.outcome();
        this.runId = result.runId();
        this.sessionKey = result.sessionKey();
    }

    public HookPhase getPhase() {
        return phase;
    }

    public String getRunId() {
        return runId;
    }

    public String getSessionKey() {
        return sessionKey;
    }

    public InvocationResult.Outcome getOutcome() {
        return outcome;
    }
}
