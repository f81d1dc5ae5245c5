package com.agentstudio.observability;

import com.agentstudio.observability.hook.BoundedInputReader;
import com.agentstudio.observability.hook.HookPayload;
import com.agentstudio.observability.hook.HookPayloadReader;
import com.agentstudio.observability.hook.HookPhase;
import com.agentstudio.observability.hook.HookResponse;
import com.agentstudio.observability.hook.HookResponseWriter;
import com.agentstudio.observability.hook.InvocationResult;
import com.agentstudio.observability.hook.RunObserverHook;
import com.agentstudio.observability.observation.InvocationObservationContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationHandler;
import io.micrometer.observation.ObservationRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests for RunObserverRunner.
 */
@ExtendWith(MockitoExtension.class)
class RunObserverRunnerTest {

    @Mock
    private ObjectProvider<RunObserverHook> hookProvider;

    @Mock
    private ObjectProvider<HookPayloadReader> payloadReaderProvider;

    @Mock
    private ObjectProvider<BoundedInputReader> inputReaderProvider;

    @Mock
    private ObjectProvider<ObservationRegistry> registryProvider;

    @Mock
    private RunObserverHook hook;

    @Mock
    private LoggingSystem loggingSystem;

    private RunObserverProperties properties;
    private ByteArrayOutputStream stdout;

    @BeforeEach
    void setUp() {
        properties = new RunObserverProperties();
        stdout = new ByteArrayOutputStream();
    }

    private RunObserverRunner runner(HookResponse defaultResponse, String stdin) {
        HookResponseWriter writer = new HookResponseWriter(new PrintStream(stdout, true, StandardCharsets.UTF_8),
                defaultResponse);
        return new RunObserverRunner(properties, hookProvider, payloadReaderProvider, inputReaderProvider,
                registryProvider, writer, loggingSystem,
                () -> new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)));
    }

    private void wireReaders(ObservationRegistry registry) {
        when(registryProvider.getIfAvailable(any())).thenReturn(registry);
        when(payloadReaderProvider.getObject()).thenReturn(new HookPayloadReader(new ObjectMapper()));
        when(inputReaderProvider.getObject())
                .thenReturn(new BoundedInputReader(Duration.ofMillis(200), Duration.ofSeconds(2), 4096));
    }

    private String output() {
        return stdout.toString(StandardCharsets.UTF_8).trim();
    }

    @Test
    @DisplayName("Pre invocation is recorded and approved")
    void run_shouldRecordAndApprove() throws Exception {
        wireReaders(ObservationRegistry.NOOP);
        when(hookProvider.getIfAvailable()).thenReturn(hook);
        when(hook.handle(eq(HookPhase.PRE), any()))
                .thenReturn(new InvocationResult(InvocationResult.Outcome.RECORDED, "run-1", "s1", null));

        runner(HookResponse.APPROVE, "{\"tool_name\":\"Bash\"}").run(new DefaultApplicationArguments("pre"));

        ArgumentCaptor<HookPayload> payload = ArgumentCaptor.forClass(HookPayload.class);
        verify(hook).handle(eq(HookPhase.PRE), payload.capture());
        assertThat(payload.getValue().toolName()).isEqualTo("Bash");
        assertThat(output()).isEqualTo(HookResponse.APPROVE.json());
    }

    @Test
    @DisplayName("Post invocation answers with the observational response")
    void run_shouldObservePost() throws Exception {
        wireReaders(ObservationRegistry.NOOP);
        when(hookProvider.getIfAvailable()).thenReturn(hook);
        when(hook.handle(eq(HookPhase.POST), any()))
                .thenReturn(new InvocationResult(InvocationResult.Outcome.DEGRADED, "run-1", "s1", null));

        runner(HookResponse.OBSERVE, "not json").run(new DefaultApplicationArguments("PostToolUse"));

        assertThat(output()).isEqualTo(HookResponse.OBSERVE.json());
    }

    @Test
    @DisplayName("Unknown phase answers without recording")
    void run_shouldSkipUnknownPhase() throws Exception {
        runner(HookResponse.OBSERVE, "{}").run(new DefaultApplicationArguments("notification"));

        verifyNoInteractions(hookProvider);
        assertThat(output()).isEqualTo(HookResponse.OBSERVE.json());
    }

    @Test
    @DisplayName("Disabled observer still answers the gate")
    void run_shouldAnswer_whenHookMissing() throws Exception {
        when(hookProvider.getIfAvailable()).thenReturn(null);

        runner(HookResponse.APPROVE, "{}").run(new DefaultApplicationArguments("pre"));

        verifyNoInteractions(payloadReaderProvider);
        assertThat(output()).isEqualTo(HookResponse.APPROVE.json());
    }

    @Test
    @DisplayName("Debug flag raises the package log level")
    void run_shouldEnableDebugLogging() throws Exception {
        properties.setDebug(true);
        when(hookProvider.getIfAvailable()).thenReturn(null);

        runner(HookResponse.OBSERVE, "{}").run(new DefaultApplicationArguments("stop"));

        verify(loggingSystem).setLogLevel(RunObserverRunner.BASE_PACKAGE, LogLevel.DEBUG);
    }

    @Test
    @DisplayName("Debug logging stays off by default")
    void run_shouldKeepLogLevel_byDefault() throws Exception {
        when(hookProvider.getIfAvailable()).thenReturn(null);

        runner(HookResponse.OBSERVE, "{}").run(new DefaultApplicationArguments("stop"));

        verify(loggingSystem, never()).setLogLevel(any(), any());
    }

    @Test
    @DisplayName("Invocation is observed with its outcome")
    void run_shouldObserveInvocation() throws Exception {
        List<InvocationObservationContext> stopped = new ArrayList<>();
        ObservationRegistry registry = ObservationRegistry.create();
        registry.observationConfig().observationHandler(new ObservationHandler<InvocationObservationContext>() {
            @Override
            public boolean supportsContext(Observation.Context context) {
                return context instanceof InvocationObservationContext;
            }

            @Override
            public void onStop(InvocationObservationContext context) {
                stopped.add(context);
            }
        });
        wireReaders(registry);
        when(hookProvider.getIfAvailable()).thenReturn(hook);
        when(hook.handle(eq(HookPhase.SUBAGENT_STOP), any()))
                .thenReturn(new InvocationResult(InvocationResult.Outcome.RECORDED, "run-9", "s9", null));

        runner(HookResponse.OBSERVE, "{}").run(new DefaultApplicationArguments("subagent-stop"));

        assertThat(stopped).hasSize(1);
        assertThat(stopped.get(0).getOutcome()).isEqualTo(InvocationResult.Outcome.RECORDED);
        assertThat(stopped.get(0).getRunId()).isEqualTo("run-9");
        assertThat(stopped.get(0).getContextualName()).isEqualTo("hook:subagent-stop");
    }
}
