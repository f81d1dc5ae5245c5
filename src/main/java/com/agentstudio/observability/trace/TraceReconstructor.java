package com.agentstudio.observability.trace;

import com.agentstudio.observability.delegation.PendingDelegation;
import com.agentstudio.observability.delegation.PendingDelegationQueue;
import com.agentstudio.observability.run.RunState;
import io.opentelemetry.api.trace.SpanContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Rebuilds parent/child span relationships across process boundaries.
 * <p>
 * Every invocation is a fresh process, so the call stack lives in the run document:
 * {@code trace.root} is the run's root span, {@code trace.agent_spans} is the table of
 * active agent frames and {@code trace.in_flight_tool} pairs a tool's pre and post events.
 * Agent nesting itself is tracked by the parent stack of {@link PendingDelegationQueue}.
 *
 * @author Agent Studio 2025-2026
 */
public class TraceReconstructor {

    private static final Logger log = LoggerFactory.getLogger(TraceReconstructor.class);

    /** Tool name of a delegation to a subagent. */
    public static final String TASK_TOOL = "Task";

    public static final String BAGGAGE_SESSION_KEY = "session_key";
    public static final String BAGGAGE_RUN_ID = "run_id";
    public static final String BAGGAGE_AGENT_NAME = "agent_name";
    public static final String BAGGAGE_WORKFLOW_ID = "workflow_id";
    public static final String BAGGAGE_WORKFLOW_STEP = "workflow_step";

    private static final Set<String> FILE_TOOLS = Set.of("Read", "Write", "Edit", "MultiEdit", "NotebookEdit");

    private final TraceIds traceIds;
    private final PendingDelegationQueue delegations;
    private final String defaultAgent;
    private final Clock clock;

    public TraceReconstructor(TraceIds traceIds, PendingDelegationQueue delegations,
                              String defaultAgent, Clock clock) {
        this.traceIds = traceIds;
        this.delegations = delegations;
        this.defaultAgent = defaultAgent;
        this.clock = clock;
    }

    /**
     * Returns the run's root span, creating it on first access. An inbound W3C traceparent
     * seen at creation time makes the root join that trace. Once set the root is never replaced.
     *
     * @param rootBaggage        baggage for a new root (session, run, workflow)
     * @param inboundTraceparent traceparent from the environment, may be null
     */
    public TraceContext ensureRoot(RunState state, Map<String, String> rootBaggage, String inboundTraceparent) {
        RunTrace trace = state.getTrace();
        if (trace.getRoot() != null && trace.getRoot().traceId() != null) {
            return trace.getRoot();
        }
        Optional<SpanContext> remote = TraceIds.parseTraceparent(inboundTraceparent);
        TraceContext root;
        if (remote.isPresent()) {
            SpanContext parent = remote.get();
            root = new TraceContext(parent.getTraceId(), traceIds.newSpanId(), parent.getSpanId(),
                    rootBaggage, parent.isSampled());
            log.debug("Root span joins inbound trace {}", parent.getTraceId());
        } else {
            String traceId = traceIds.newTraceId();
            root = new TraceContext(traceId, traceIds.newSpanId(), null, rootBaggage,
                    traceIds.shouldSample(traceId));
        }
        trace.setRoot(root);
        return root;
    }

    /**
     * An agent enters. When {@code explicitAgent} is null the oldest valid pending delegation
     * names it, falling back to the last known current agent. The agent that was current
     * before is pushed on the parent stack and the new span is parented to its frame.
     */
    public SpanAssignment startAgent(RunState state, String explicitAgent) {
        String previous = state.getCurrentAgent() != null ? state.getCurrentAgent() : defaultAgent;
        Optional<PendingDelegation> consumed = delegations.consume(state, explicitAgent);

        String agent;
        String parentAgent;
        if (explicitAgent != null) {
            agent = explicitAgent;
            parentAgent = consumed.map(PendingDelegation::parent).orElse(previous);
        } else if (consumed.isPresent()) {
            agent = consumed.get().agent();
            parentAgent = consumed.get().parent() != null ? consumed.get().parent() : previous;
        } else {
            agent = previous;
            parentAgent = previous;
            log.debug("Agent start without name or pending delegation, attributed to {}", agent);
        }
        delegations.pushParent(state, parentAgent);

        String parentSpanId = frameSpanId(state, parentAgent);
        String spanId = traceIds.newSpanId();
        state.getTrace().getAgentSpans().put(agent, new AgentSpan(spanId, parentSpanId, now()));
        state.setCurrentAgent(agent);
        return new SpanAssignment(agent, spanId, parentSpanId, agentKind(agent), TraceEventType.AGENT_START);
    }

    /**
     * An agent exits: its frame is removed and the current agent restored from the parent stack.
     * An empty stack leaves the current agent unchanged. When the stopping agent is not the
     * current one the current agent keeps running and only one stack level is unwound.
     */
    public SpanAssignment stopAgent(RunState state, String explicitAgent) {
        String agent = explicitAgent != null ? explicitAgent
                : state.getCurrentAgent() != null ? state.getCurrentAgent() : defaultAgent;
        AgentSpan frame = state.getTrace().getAgentSpans().remove(agent);

        String spanId;
        String parentSpanId;
        if (frame != null) {
            spanId = frame.spanId();
            parentSpanId = frame.parentSpanId();
        } else {
            spanId = traceIds.newSpanId();
            parentSpanId = rootSpanId(state);
            log.debug("Agent stop for {} without an active frame", agent);
        }
        String current = state.getCurrentAgent() != null ? state.getCurrentAgent() : defaultAgent;
        if (agent.equals(current)) {
            delegations.popParent(state).ifPresent(state::setCurrentAgent);
        } else {
            log.debug("Agent {} stopped while {} is current", agent, current);
            delegations.unwindParent(state, agent);
        }
        return new SpanAssignment(agent, spanId, parentSpanId, agentKind(agent), TraceEventType.AGENT_STOP);
    }

    /**
     * Opens a tool span parented to the calling agent's frame (or root) and records it as the
     * in-flight tool.
     */
    public SpanAssignment startTool(RunState state, String agent, String tool, SpanKind kind) {
        String parentSpanId = frameSpanId(state, agent);
        String spanId = traceIds.newSpanId();
        state.getTrace().setInFlightTool(new InFlightToolSpan(agent, tool, spanId, parentSpanId, now()));
        TraceEventType type = TASK_TOOL.equals(tool) ? TraceEventType.HANDOFF : TraceEventType.TOOL_CALL_START;
        return new SpanAssignment(agent, spanId, parentSpanId, kind, type);
    }

    /**
     * Closes a tool span. A matching in-flight record yields the pre event's span; when
     * another event interleaved the post gets a fresh span parented to root and the
     * in-flight record is left for its own post event.
     */
    public SpanAssignment endTool(RunState state, String agent, String tool, SpanKind kind) {
        RunTrace trace = state.getTrace();
        InFlightToolSpan inFlight = trace.getInFlightTool();
        TraceEventType type = TASK_TOOL.equals(tool) ? TraceEventType.HANDOFF : TraceEventType.TOOL_CALL_STOP;
        if (inFlight != null && inFlight.matches(agent, tool) && inFlight.spanId() != null) {
            trace.setInFlightTool(null);
            return new SpanAssignment(agent, inFlight.spanId(), inFlight.parentSpanId(), kind, type);
        }
        log.debug("No matching in-flight span for {}/{}, parenting to root", agent, tool);
        return new SpanAssignment(agent, traceIds.newSpanId(), rootSpanId(state), kind, type);
    }

    /**
     * Session phases are reported on the root span itself.
     */
    public SpanAssignment sessionEvent(RunState state, String agent, boolean end) {
        TraceContext root = state.getTrace().getRoot();
        return new SpanAssignment(agent, root.spanId(), root.parentSpanId(), SpanKind.CHAIN,
                end ? TraceEventType.SPAN_END : TraceEventType.SPAN_START);
    }

    /**
     * Builds the context of an emitted event: the run's trace id, the assigned span and the
     * root baggage plus the attributed agent.
     */
    public TraceContext contextFor(RunState state, SpanAssignment assignment) {
        TraceContext root = state.getTrace().getRoot();
        Map<String, String> baggage = new LinkedHashMap<>(root.baggage());
        if (assignment.agent() != null) {
            baggage.put(BAGGAGE_AGENT_NAME, assignment.agent());
        }
        return new TraceContext(root.traceId(), assignment.spanId(), assignment.parentSpanId(), baggage,
                root.sampled());
    }

    /**
     * Span kind for an agent lifecycle event.
     */
    public static SpanKind agentKind(String agent) {
        return agent != null && agent.toLowerCase(Locale.ROOT).contains("router") ? SpanKind.ROUTER : SpanKind.AGENT;
    }

    /**
     * Span kind for a tool event.
     *
     * @param tool           tool name
     * @param delegatedAgent target agent of a Task, else null
     * @param touchedPath    resolved file path of a file tool, else null
     * @param contextDir     internal context directory
     */
    public static SpanKind toolKind(String tool, String delegatedAgent, Path touchedPath, Path contextDir) {
        if (TASK_TOOL.equals(tool)) {
            return agentKind(delegatedAgent);
        }
        if (tool != null && FILE_TOOLS.contains(tool) && touchedPath != null && contextDir != null
                && touchedPath.normalize().startsWith(contextDir.normalize())) {
            return SpanKind.ARTIFACT;
        }
        return SpanKind.TOOL;
    }

    private String frameSpanId(RunState state, String agent) {
        AgentSpan frame = agent == null ? null : state.getTrace().getAgentSpans().get(agent);
        return frame != null && frame.spanId() != null ? frame.spanId() : rootSpanId(state);
    }

    private static String rootSpanId(RunState state) {
        TraceContext root = state.getTrace().getRoot();
        return root == null ? null : root.spanId();
    }

    private String now() {
        return Instant.now(clock).toString();
    }
}
