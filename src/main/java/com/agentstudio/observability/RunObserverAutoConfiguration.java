package com.agentstudio.observability;

import com.agentstudio.observability.delegation.PendingDelegationQueue;
import com.agentstudio.observability.event.AgentTaskArtifactWriter;
import com.agentstudio.observability.event.EventLog;
import com.agentstudio.observability.event.LastRunPointer;
import com.agentstudio.observability.event.RunSummaryWriter;
import com.agentstudio.observability.event.ToolEventsMirror;
import com.agentstudio.observability.failure.FailureBundleGenerator;
import com.agentstudio.observability.failure.FileFailureBundleGenerator;
import com.agentstudio.observability.hook.BoundedInputReader;
import com.agentstudio.observability.hook.HookEnvironment;
import com.agentstudio.observability.hook.HookPayloadReader;
import com.agentstudio.observability.hook.InvocationDeadline;
import com.agentstudio.observability.hook.RecursionGuard;
import com.agentstudio.observability.hook.RunObserverHook;
import com.agentstudio.observability.hook.SideChannelPublisher;
import com.agentstudio.observability.metrics.MetricsAggregator;
import com.agentstudio.observability.observation.InvocationLoggingObservationHandler;
import com.agentstudio.observability.payload.PayloadStore;
import com.agentstudio.observability.payload.SecretRedactor;
import com.agentstudio.observability.routing.RoutingDecisionReader;
import com.agentstudio.observability.routing.RoutingHandoffRecorder;
import com.agentstudio.observability.run.RunPaths;
import com.agentstudio.observability.run.RunRegistry;
import com.agentstudio.observability.run.RunStateStore;
import com.agentstudio.observability.session.SessionKeyResolver;
import com.agentstudio.observability.session.SharedSessionKeyStore;
import com.agentstudio.observability.trace.TraceIds;
import com.agentstudio.observability.trace.TraceReconstructor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.observation.ObservationHandler;
import io.micrometer.observation.ObservationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

import java.time.Clock;

/**
 * Auto-configuration for the Agent Studio run observer.
 * Wires the session, run, trace and side-channel components into a {@link RunObserverHook}.
 *
 * @author Agent Studio 2025-2026
 * @see RunObserverProperties
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration")
@EnableConfigurationProperties(RunObserverProperties.class)
@ConditionalOnProperty(prefix = "agent-studio.observability", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RunObserverAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RunObserverAutoConfiguration.class);

    /**
     * Default constructor.
     */
    public RunObserverAutoConfiguration() {
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock runObserverClock() {
        return Clock.systemUTC();
    }

    /**
     * Mapper for the run documents when Jackson is not auto-configured.
     *
     * @return a mapper tolerant of unknown fields
     */
    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        log.debug("No ObjectMapper found, creating a default one");
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Bean
    public RunPaths runPaths(RunObserverProperties properties) {
        return new RunPaths(properties);
    }

    @Bean
    public HookEnvironment hookEnvironment(Environment environment) {
        return new HookEnvironment(environment);
    }

    // Session and run

    @Bean
    public SharedSessionKeyStore sharedSessionKeyStore(RunPaths paths, ObjectMapper objectMapper,
                                                       RunObserverProperties properties, Clock clock) {
        return new SharedSessionKeyStore(paths, objectMapper, properties.getSession().getSharedKeyTtl(), clock);
    }

    @Bean
    public SessionKeyResolver sessionKeyResolver(SharedSessionKeyStore sharedSessionKeyStore,
                                                 HookEnvironment hookEnvironment, RunObserverProperties properties) {
        return new SessionKeyResolver(sharedSessionKeyStore, hookEnvironment, properties.getSessionEnvVariables());
    }

    @Bean
    public RunRegistry runRegistry(RunPaths paths, ObjectMapper objectMapper, Clock clock) {
        return new RunRegistry(paths, objectMapper, clock);
    }

    @Bean
    public RunStateStore runStateStore(RunPaths paths, ObjectMapper objectMapper,
                                       RunObserverProperties properties, Clock clock) {
        return new RunStateStore(paths, objectMapper, properties.getState().getMaxWriteRetries(), clock);
    }

    // Trace, delegation and metrics

    @Bean
    public TraceIds traceIds(RunObserverProperties properties) {
        return new TraceIds(properties.getTrace().getSampleRatio());
    }

    @Bean
    public PendingDelegationQueue pendingDelegationQueue(RunObserverProperties properties, Clock clock) {
        return new PendingDelegationQueue(properties.getDelegation(), clock);
    }

    @Bean
    public MetricsAggregator metricsAggregator(RunObserverProperties properties, Clock clock) {
        return new MetricsAggregator(properties.getMetrics(), clock);
    }

    @Bean
    public TraceReconstructor traceReconstructor(TraceIds traceIds, PendingDelegationQueue pendingDelegationQueue,
                                                 RunObserverProperties properties, Clock clock) {
        return new TraceReconstructor(traceIds, pendingDelegationQueue, properties.getDefaultAgent(), clock);
    }

    // Routing

    @Bean
    public RoutingDecisionReader routingDecisionReader(RunPaths paths, ObjectMapper objectMapper) {
        return new RoutingDecisionReader(paths, objectMapper);
    }

    @Bean
    public RoutingHandoffRecorder routingHandoffRecorder(RunPaths paths, ToolEventsMirror toolEventsMirror,
                                                         ObjectMapper objectMapper, Clock clock) {
        return new RoutingHandoffRecorder(paths, toolEventsMirror, objectMapper, clock);
    }

    // Side channels

    @Bean
    public EventLog eventLog(RunPaths paths, ObjectMapper objectMapper, RunObserverProperties properties) {
        return new EventLog(paths, objectMapper, properties.getEvents());
    }

    @Bean
    public ToolEventsMirror toolEventsMirror(RunPaths paths, ObjectMapper objectMapper) {
        return new ToolEventsMirror(paths, objectMapper);
    }

    @Bean
    public LastRunPointer lastRunPointer(RunPaths paths, ObjectMapper objectMapper, Clock clock) {
        return new LastRunPointer(paths, objectMapper, clock);
    }

    @Bean
    public RunSummaryWriter runSummaryWriter(RunPaths paths) {
        return new RunSummaryWriter(paths);
    }

    @Bean
    public SecretRedactor secretRedactor() {
        return new SecretRedactor();
    }

    @Bean
    public AgentTaskArtifactWriter agentTaskArtifactWriter(RunPaths paths, ObjectMapper objectMapper,
                                                           SecretRedactor secretRedactor, Clock clock) {
        return new AgentTaskArtifactWriter(paths, objectMapper, secretRedactor, clock);
    }

    @Bean
    public PayloadStore payloadStore(RunPaths paths, RunObserverProperties properties, SecretRedactor secretRedactor,
                                     ObjectMapper objectMapper, Clock clock) {
        return new PayloadStore(paths.payloadsDir(), properties.getPayloads().getMaxBytes(), secretRedactor,
                objectMapper, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public FailureBundleGenerator failureBundleGenerator(RunPaths paths, RunObserverProperties properties,
                                                         SecretRedactor secretRedactor,
                                                         ObjectMapper objectMapper, Clock clock) {
        RunObserverProperties.FailureBundles config = properties.getFailureBundles();
        return new FileFailureBundleGenerator(paths, paths.failureBundlesDir(), config.getTailLines(),
                config.getTailBytes(), secretRedactor, objectMapper, clock);
    }

    /**
     * Publishes events and side channels. Payload capture and failure bundles are only handed
     * over when their flags are on.
     *
     * @return the publisher
     */
    @Bean
    public SideChannelPublisher sideChannelPublisher(EventLog eventLog, ToolEventsMirror toolEventsMirror,
                                                     LastRunPointer lastRunPointer, RunSummaryWriter runSummaryWriter,
                                                     AgentTaskArtifactWriter agentTaskArtifactWriter,
                                                     RoutingHandoffRecorder routingHandoffRecorder,
                                                     PayloadStore payloadStore,
                                                     FailureBundleGenerator failureBundleGenerator,
                                                     RunObserverProperties properties, ObjectMapper objectMapper) {
        PayloadStore payloads = properties.getPayloads().isEnabled() ? payloadStore : null;
        FailureBundleGenerator bundles = properties.getFailureBundles().isEnabled() ? failureBundleGenerator : null;
        if (payloads != null || bundles != null) {
            log.debug("Payload capture: {}, failure bundles: {}", payloads != null, bundles != null);
        }
        return new SideChannelPublisher(eventLog, toolEventsMirror, lastRunPointer, runSummaryWriter,
                agentTaskArtifactWriter, routingHandoffRecorder, payloads, bundles, objectMapper);
    }

    // Invocation

    @Bean
    public RecursionGuard recursionGuard(RunPaths paths, HookEnvironment hookEnvironment,
                                         ObjectProvider<InvocationDeadline> deadlineProvider) {
        RecursionGuard guard = new RecursionGuard(paths.guardsDir(), hookEnvironment);
        // the deadline halts without unwinding, so the marker would outlive the process
        deadlineProvider.ifAvailable(deadline -> deadline.beforeTermination(guard::release));
        return guard;
    }

    @Bean
    public HookPayloadReader hookPayloadReader(ObjectMapper objectMapper) {
        return new HookPayloadReader(objectMapper);
    }

    @Bean
    public BoundedInputReader boundedInputReader(RunObserverProperties properties) {
        RunObserverProperties.Input input = properties.getInput();
        return new BoundedInputReader(input.getIdleTimeout(), input.getTotalTimeout(), input.getMaxBytes());
    }

    /**
     * Creates the hook invocation pipeline.
     *
     * @return the configured hook
     */
    @Bean
    public RunObserverHook runObserverHook(RunObserverProperties properties, RunPaths paths,
                                           HookEnvironment hookEnvironment, RecursionGuard recursionGuard,
                                           SessionKeyResolver sessionKeyResolver, RunRegistry runRegistry,
                                           RunStateStore runStateStore, RoutingDecisionReader routingDecisionReader,
                                           RoutingHandoffRecorder routingHandoffRecorder,
                                           TraceReconstructor traceReconstructor,
                                           PendingDelegationQueue pendingDelegationQueue,
                                           MetricsAggregator metricsAggregator,
                                           SideChannelPublisher sideChannelPublisher, Clock clock) {
        log.debug("Run observer writing under {}", paths.runtimeRoot());
        return new RunObserverHook(properties, paths, hookEnvironment, recursionGuard, sessionKeyResolver,
                runRegistry, runStateStore, routingDecisionReader, routingHandoffRecorder, traceReconstructor,
                pendingDelegationQueue, metricsAggregator, sideChannelPublisher, clock);
    }

    // Self-observation

    @Bean
    @ConditionalOnMissingBean
    public InvocationLoggingObservationHandler invocationLoggingObservationHandler() {
        return new InvocationLoggingObservationHandler();
    }

    /**
     * Observation registry for invocation self-observation, with every registered handler attached.
     *
     * @param handlers the observation handlers
     * @return the registry
     */
    @Bean
    @ConditionalOnMissingBean
    public ObservationRegistry observationRegistry(ObjectProvider<ObservationHandler<?>> handlers) {
        ObservationRegistry registry = ObservationRegistry.create();
        handlers.orderedStream().forEach(handler -> registry.observationConfig().observationHandler(handler));
        return registry;
    }
}
