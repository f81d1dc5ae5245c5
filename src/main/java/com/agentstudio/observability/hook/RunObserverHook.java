package com.agentstudio.observability.hook;

import com.agentstudio.observability.RunObserverProperties;
import com.agentstudio.observability.delegation.PendingDelegationQueue;
import com.agentstudio.observability.event.RunEvent;
import com.agentstudio.observability.metrics.MetricsAggregator;
import com.agentstudio.observability.routing.RoutingDecisionReader;
import com.agentstudio.observability.routing.RoutingHandoffRecorder;
import com.agentstudio.observability.routing.RoutingState;
import com.agentstudio.observability.run.FailureDetector;
import com.agentstudio.observability.run.RunError;
import com.agentstudio.observability.run.RunPaths;
import com.agentstudio.observability.run.RunRegistry;
import com.agentstudio.observability.run.RunState;
import com.agentstudio.observability.run.RunStateStore;
import com.agentstudio.observability.session.SessionKeyResolver;
import com.agentstudio.observability.trace.SpanAssignment;
import com.agentstudio.observability.trace.SpanKind;
import com.agentstudio.observability.trace.TraceContext;
import com.agentstudio.observability.trace.TraceReconstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Processes one hook invocation: resolves the session and run, folds the invocation into the
 * run document, then publishes the event and side channels.
 * <p>
 * This is the fail-open boundary. Any failure is logged to stderr and reported in the
 * {@link InvocationResult}; callers always answer the host with the default response.
 *
 * @author Agent Studio 2025-2026
 */
public class RunObserverHook {

    private static final Logger log = LoggerFactory.getLogger(RunObserverHook.class);

    static final String UNKNOWN_TOOL = "unknown";

    private final RunObserverProperties properties;
    private final RunPaths paths;
    private final HookEnvironment environment;
    private final RecursionGuard recursionGuard;
    private final SessionKeyResolver sessionResolver;
    private final RunRegistry registry;
    private final RunStateStore stateStore;
    private final RoutingDecisionReader routingReader;
    private final RoutingHandoffRecorder routingRecorder;
    private final TraceReconstructor traces;
    private final PendingDelegationQueue delegations;
    private final MetricsAggregator metrics;
    private final SideChannelPublisher publisher;
    private final Clock clock;

    public RunObserverHook(RunObserverProperties properties, RunPaths paths, HookEnvironment environment,
                           RecursionGuard recursionGuard, SessionKeyResolver sessionResolver,
                           RunRegistry registry, RunStateStore stateStore,
                           RoutingDecisionReader routingReader, RoutingHandoffRecorder routingRecorder,
                           TraceReconstructor traces, PendingDelegationQueue delegations,
                           MetricsAggregator metrics, SideChannelPublisher publisher, Clock clock) {
        this.properties = properties;
        this.paths = paths;
        this.environment = environment;
        this.recursionGuard = recursionGuard;
        this.sessionResolver = sessionResolver;
        this.registry = registry;
        this.stateStore = stateStore;
        this.routingReader = routingReader;
        this.routingRecorder = routingRecorder;
        this.traces = traces;
        this.delegations = delegations;
        this.metrics = metrics;
        this.publisher = publisher;
        this.clock = clock;
    }

    /** Document changes of one invocation, kept for publishing after the commit. */
    private record Applied(RunState state, RunEvent event, boolean handoffRecorded) {
    }

    /**
     * Handles one invocation. Never throws.
     */
    public InvocationResult handle(HookPhase phase, HookPayload payload) {
        if (!properties.isEnabled()) {
            return InvocationResult.skipped(InvocationResult.Outcome.DISABLED);
        }
        try {
            if (recursionGuard.isNested()) {
                log.debug("Nested observer invocation, skipping {}", phase.value());
                return InvocationResult.skipped(InvocationResult.Outcome.NESTED);
            }
            try (RecursionGuard.Marker ignored = enterGuard()) {
                return record(phase, payload == null ? HookPayload.empty() : payload);
            }
        } catch (Exception e) {
            log.warn("Run observer failed during {}: {}", phase.value(), e.toString());
            log.debug("Run observer failure", e);
            return InvocationResult.skipped(InvocationResult.Outcome.FAILED);
        }
    }

    private InvocationResult record(HookPhase phase, HookPayload payload) {
        String sessionKey = sessionResolver.resolve(payload.sessionId()).key();
        String runId = registry.resolveRunId(sessionKey);
        Optional<RoutingState> routing = routingReader.read(sessionKey);
        Optional<String> envAgent = environment.first(properties.getAgentEnvVariables());

        AtomicReference<Applied> last = new AtomicReference<>();
        InvocationResult.Outcome outcome = InvocationResult.Outcome.RECORDED;
        try {
            stateStore.update(runId, sessionKey, state -> {
                Applied applied = apply(state, phase, payload, envAgent, routing);
                last.set(applied);
                return applied;
            });
        } catch (IOException e) {
            log.warn("Unable to persist run state for {}: {}", runId, e.getMessage());
            outcome = InvocationResult.Outcome.DEGRADED;
        }

        Applied applied = last.get();
        if (applied == null) {
            return new InvocationResult(outcome, runId, sessionKey, null);
        }
        publisher.publish(phase, payload, applied.state(), applied.event(), applied.handoffRecorded());
        return new InvocationResult(outcome, runId, sessionKey, applied.event());
    }

    private Applied apply(RunState state, HookPhase phase, HookPayload payload, Optional<String> envAgent,
                          Optional<RoutingState> routing) {
        String now = Instant.now(clock).toString();
        state.setLastHeartbeatAt(now);
        state.setLastEventAt(now);
        state.setEventsCount(state.getEventsCount() + 1);
        routing.ifPresent(ingested -> RoutingDecisionReader.merge(state, ingested));
        traces.ensureRoot(state, rootBaggage(state), environment.traceparent().orElse(null));

        RunEvent event = new RunEvent();
        event.setTs(now);
        event.setPhase(phase.value());
        event.setRunId(state.getRunId());
        event.setSessionKey(state.getSessionKey());

        boolean handoffRecorded = false;
        SpanAssignment assignment;
        switch (phase) {
            case SUBAGENT_START -> {
                assignment = traces.startAgent(state, payload.agentName());
                state.markActive();
                state.setCurrentActivity(phase.value());
            }
            case SUBAGENT_STOP -> {
                assignment = traces.stopAgent(state, payload.agentName());
                state.setCurrentActivity(phase.value());
            }
            case SESSION_START -> {
                state.markActive();
                assignment = traces.sessionEvent(state, currentAgent(state), false);
                state.setCurrentActivity(phase.value());
            }
            case STOP, SESSION_END -> {
                assignment = traces.sessionEvent(state, currentAgent(state), true);
                state.markCompleted();
                state.setCurrentActivity(phase.value());
            }
            default -> {
                ToolCall call = toolCall(state, payload, envAgent);
                assignment = phase == HookPhase.PRE ? toolStarted(state, call) : toolFinished(state, call, payload, event, now);
                handoffRecorded = phase == HookPhase.POST && call.isTask()
                        && routingRecorder.onTaskCompleted(state, call.delegatedAgent()).isPresent();
                state.setCurrentActivity(call.tool());
                event.setTool(call.tool());
                event.setActivity(call.tool());
                event.setDelegatedAgent(call.delegatedAgent());
            }
        }
        if (event.getActivity() == null) {
            event.setActivity(phase.value());
        }

        TraceContext context = traces.contextFor(state, assignment);
        event.setAgent(assignment.agent());
        event.setTraceId(context.traceId());
        event.setSpanId(context.spanId());
        event.setParentSpanId(assignment.parentSpanId());
        event.setTraceparent(context.traceparent());
        event.setBaggage(context.baggage());
        event.setSpanKind(assignment.kind());
        event.setEventType(assignment.eventType());
        return new Applied(state, event, handoffRecorded);
    }

    /** The tool call of a pre or post invocation, with the caller attributed. */
    private record ToolCall(String agent, String tool, String delegatedAgent, SpanKind kind) {

        boolean isTask() {
            return TraceReconstructor.TASK_TOOL.equals(tool);
        }
    }

    private ToolCall toolCall(RunState state, HookPayload payload, Optional<String> envAgent) {
        String named = payload.agentName() != null ? payload.agentName() : envAgent.orElse(null);
        if (named != null) {
            state.setCurrentAgent(named);
        }
        String agent = currentAgent(state);
        String tool = payload.hasTool() ? payload.toolName().trim() : UNKNOWN_TOOL;
        String delegated = TraceReconstructor.TASK_TOOL.equals(tool) ? payload.delegatedAgent() : null;
        SpanKind kind = TraceReconstructor.toolKind(tool, delegated, touchedPath(payload.filePath()), paths.contextDir());
        return new ToolCall(agent, tool, delegated, kind);
    }

    private SpanAssignment toolStarted(RunState state, ToolCall call) {
        SpanAssignment assignment = traces.startTool(state, call.agent(), call.tool(), call.kind());
        metrics.recordStart(state.getMetrics(), call.agent(), call.tool());
        if (call.isTask() && call.delegatedAgent() != null) {
            delegations.enqueue(state, call.delegatedAgent(), call.agent());
        }
        state.markActive();
        return assignment;
    }

    private SpanAssignment toolFinished(RunState state, ToolCall call, HookPayload payload, RunEvent event,
                                        String now) {
        SpanAssignment assignment = traces.endTool(state, call.agent(), call.tool(), call.kind());
        metrics.recordEnd(state.getMetrics(), call.agent(), call.tool()).ifPresent(event::setDurationMs);

        Optional<String> failure = FailureDetector.detect(payload.toolResult());
        if (failure.isPresent()) {
            state.recordError(new RunError(now, call.agent(), call.tool(), failure.get()),
                    properties.getEvents().getMaxErrors());
            event.setOk(false);
            event.setError(failure.get());
        } else {
            state.markActive();
        }
        if (call.isTask()) {
            state.setCurrentStep(state.getCurrentStep() + 1);
        }
        return assignment;
    }

    private Map<String, String> rootBaggage(RunState state) {
        Map<String, String> baggage = new LinkedHashMap<>();
        baggage.put(TraceReconstructor.BAGGAGE_SESSION_KEY, state.getSessionKey());
        baggage.put(TraceReconstructor.BAGGAGE_RUN_ID, state.getRunId());
        environment.get(HookEnvironment.WORKFLOW_ID)
                .ifPresent(id -> baggage.put(TraceReconstructor.BAGGAGE_WORKFLOW_ID, id));
        environment.get(HookEnvironment.WORKFLOW_STEP)
                .ifPresent(step -> baggage.put(TraceReconstructor.BAGGAGE_WORKFLOW_STEP, step));
        return baggage;
    }

    private String currentAgent(RunState state) {
        return state.getCurrentAgent() != null ? state.getCurrentAgent() : properties.getDefaultAgent();
    }

    private Path touchedPath(String filePath) {
        if (filePath == null || filePath.isBlank()) {
            return null;
        }
        try {
            return paths.resolve(filePath);
        } catch (InvalidPathException e) {
            log.debug("Ignoring unusable file path {}", filePath);
            return null;
        }
    }

    private RecursionGuard.Marker enterGuard() {
        try {
            return recursionGuard.enter();
        } catch (IOException e) {
            log.debug("Unable to write recursion marker: {}", e.getMessage());
            return null;
        }
    }
}
