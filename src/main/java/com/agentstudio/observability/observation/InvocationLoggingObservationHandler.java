package com.agentstudio.observability.observation;

import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Logs each hook invocation with its phase, outcome and elapsed time.
 * Output goes through SLF4J, so it ends up on stderr with the rest of the logs.
 *
 * @author Agent Studio 2025-2026
 */
public class InvocationLoggingObservationHandler implements ObservationHandler<InvocationObservationContext> {

    private static final Logger log = LoggerFactory.getLogger(InvocationLoggingObservationHandler.class);

    static final String START_NANOS_KEY = "agent.studio.start-nanos";

    /**
     * Default constructor.
     */
    public InvocationLoggingObservationHandler() {
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean supportsContext(Observation.Context context) {
        return context instanceof InvocationObservationContext;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void onStart(InvocationObservationContext context) {
        context.put(START_NANOS_KEY, System.nanoTime());
        log.debug("Hook invocation started: {}", context.getPhase().value());
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void onError(InvocationObservationContext context) {
        Throwable error = context.getError();
        log.warn("Hook invocation {} raised {}", context.getPhase().value(),
                error == null ? "an unknown error" : error.toString());
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void onStop(InvocationObservationContext context) {
        log.debug("Hook invocation finished: phase={}, outcome={}, run={}, session={}, elapsed={}ms",
                context.getPhase().value(), context.getOutcome(), context.getRunId(), context.getSessionKey(),
                elapsedMillis(context));
    }

    /**
     * Milliseconds since {@link #onStart}, or -1 when the start was not seen.
     */
    long elapsedMillis(InvocationObservationContext context) {
        Long start = context.get(START_NANOS_KEY);
        if (start == null) {
            return -1;
        }
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }
}
