package com.agentstudio.observability.hook;

import com.agentstudio.observability.event.AgentTaskArtifactWriter;
import com.agentstudio.observability.event.EventLog;
import com.agentstudio.observability.event.LastRunPointer;
import com.agentstudio.observability.event.RunEvent;
import com.agentstudio.observability.event.RunSummaryWriter;
import com.agentstudio.observability.event.ToolEventsMirror;
import com.agentstudio.observability.failure.FailureBundleGenerator;
import com.agentstudio.observability.failure.FailureBundleRequest;
import com.agentstudio.observability.failure.FailureBundleResult;
import com.agentstudio.observability.payload.PayloadStore;
import com.agentstudio.observability.routing.RoutingHandoffRecorder;
import com.agentstudio.observability.run.RunState;
import com.agentstudio.observability.trace.TraceReconstructor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes everything derived from a committed invocation: the event log line and the optional
 * channels around it. Each channel is its own failure domain; one failing never stops the others.
 *
 * @author Agent Studio 2025-2026
 */
public class SideChannelPublisher {

    private static final Logger log = LoggerFactory.getLogger(SideChannelPublisher.class);

    public static final String FAILURE_TYPE_TOOL_ERROR = "tool_error";

    private final EventLog eventLog;
    private final ToolEventsMirror toolEvents;
    private final LastRunPointer lastRun;
    private final RunSummaryWriter summary;
    private final AgentTaskArtifactWriter taskArtifacts;
    private final RoutingHandoffRecorder routingRecorder;
    private final PayloadStore payloadStore;
    private final FailureBundleGenerator failureBundles;
    private final ObjectMapper objectMapper;

    /**
     * @param payloadStore   payload store, null when payload capture is off
     * @param failureBundles bundle generator, null when failure bundles are off
     */
    public SideChannelPublisher(EventLog eventLog, ToolEventsMirror toolEvents, LastRunPointer lastRun,
                                RunSummaryWriter summary, AgentTaskArtifactWriter taskArtifacts,
                                RoutingHandoffRecorder routingRecorder, PayloadStore payloadStore,
                                FailureBundleGenerator failureBundles, ObjectMapper objectMapper) {
        this.eventLog = eventLog;
        this.toolEvents = toolEvents;
        this.lastRun = lastRun;
        this.summary = summary;
        this.taskArtifacts = taskArtifacts;
        this.routingRecorder = routingRecorder;
        this.payloadStore = payloadStore;
        this.failureBundles = failureBundles;
        this.objectMapper = objectMapper;
    }

    /**
     * Publishes one invocation.
     *
     * @param phase           invocation phase
     * @param payload         normalized payload
     * @param state           the run document as committed (or as last applied)
     * @param event           the event to append; payload and bundle references are added here
     * @param handoffRecorded true when this invocation completed a routing handoff
     */
    public void publish(HookPhase phase, HookPayload payload, RunState state, RunEvent event,
                        boolean handoffRecorded) {
        if (payloadStore != null && phase.isToolPhase()) {
            bestEffort("payload store", () -> payloadStore
                    .store(event.getTraceId(), event.getSpanId(), payload.toolInput(), payload.toolResult())
                    .ifPresent(event::setPayload));
        }
        if (failureBundles != null && !event.isOk()) {
            bestEffort("failure bundle", () -> {
                FailureBundleResult bundle = failureBundles.generate(FailureBundleRequest.forRun(
                        event.getTraceId(), event.getSpanId(), event.getRunId(), event.getSessionKey(),
                        FAILURE_TYPE_TOOL_ERROR, objectMapper.valueToTree(event)));
                event.setFailureBundle(bundle.bundleId());
            });
        }

        if (!eventLog.append(state.getRunId(), event, state.getEventsCount())) {
            log.debug("Event for run {} was not written", state.getRunId());
        }

        bestEffort("tool events", () -> toolEvents.append(event));
        bestEffort("last run pointer", () -> lastRun.update(state));
        bestEffort("run summary", () -> summary.write(state));
        if (phase == HookPhase.POST && TraceReconstructor.TASK_TOOL.equals(event.getTool())) {
            bestEffort("agent task artifact", () -> taskArtifacts.write(event, payload.toolResult()));
        }
        if (handoffRecorded) {
            bestEffort("routing handoff artifact", () -> routingRecorder.writeArtifact(state, event.getSessionKey()));
        }
    }

    private static void bestEffort(String channel, SideChannel action) {
        try {
            action.run();
        } catch (Exception e) {
            log.debug("Side channel '{}' failed: {}", channel, e.getMessage());
        }
    }

    @FunctionalInterface
    private interface SideChannel {
        void run() throws Exception;
    }
}
