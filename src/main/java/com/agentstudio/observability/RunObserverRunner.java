package com.agentstudio.observability;

import com.agentstudio.observability.hook.BoundedInputReader;
import com.agentstudio.observability.hook.HookPayload;
import com.agentstudio.observability.hook.HookPayloadReader;
import com.agentstudio.observability.hook.HookPhase;
import com.agentstudio.observability.hook.HookResponse;
import com.agentstudio.observability.hook.HookResponseWriter;
import com.agentstudio.observability.hook.RunObserverHook;
import com.agentstudio.observability.observation.InvocationObservationContext;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;

import java.io.InputStream;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs one hook invocation: reads the payload from stdin, hands it to the {@link RunObserverHook}
 * inside an observation and answers the host.
 *
 * @author Agent Studio 2025-2026
 */
public class RunObserverRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(RunObserverRunner.class);

    static final String BASE_PACKAGE = "com.agentstudio.observability";

    private final RunObserverProperties properties;
    private final ObjectProvider<RunObserverHook> hookProvider;
    private final ObjectProvider<HookPayloadReader> payloadReaderProvider;
    private final ObjectProvider<BoundedInputReader> inputReaderProvider;
    private final ObjectProvider<ObservationRegistry> observationRegistryProvider;
    private final HookResponseWriter responseWriter;
    private final LoggingSystem loggingSystem;
    private final Supplier<InputStream> stdin;

    public RunObserverRunner(RunObserverProperties properties,
                             ObjectProvider<RunObserverHook> hookProvider,
                             ObjectProvider<HookPayloadReader> payloadReaderProvider,
                             ObjectProvider<BoundedInputReader> inputReaderProvider,
                             ObjectProvider<ObservationRegistry> observationRegistryProvider,
                             HookResponseWriter responseWriter, LoggingSystem loggingSystem,
                             Supplier<InputStream> stdin) {
        this.properties = properties;
        this.hookProvider = hookProvider;
        this.payloadReaderProvider = payloadReaderProvider;
        this.inputReaderProvider = inputReaderProvider;
        this.observationRegistryProvider = observationRegistryProvider;
        this.responseWriter = responseWriter;
        this.loggingSystem = loggingSystem;
        this.stdin = stdin;
    }

    @Override
    public void run(ApplicationArguments args) {
        Optional<HookPhase> parsed = phaseOf(args);
        if (parsed.isEmpty()) {
            log.warn("Unknown hook phase {}, answering without recording", args.getNonOptionArgs());
            responseWriter.emitDefault();
            return;
        }
        HookPhase phase = parsed.get();
        if (properties.isDebug() && loggingSystem != null) {
            loggingSystem.setLogLevel(BASE_PACKAGE, LogLevel.DEBUG);
        }

        RunObserverHook hook = hookProvider.getIfAvailable();
        if (hook == null) {
            log.debug("Run observer disabled, answering {} only", phase.value());
            responseWriter.emit(HookResponse.forPhase(phase));
            return;
        }

        HookPayload payload = readPayload();
        InvocationObservationContext context = InvocationObservationContext.forPhase(phase);
        ObservationRegistry registry = observationRegistryProvider.getIfAvailable(() -> ObservationRegistry.NOOP);
        Observation.createNotStarted(context.getName(), () -> context, registry)
                .observe(() -> context.complete(hook.handle(phase, payload)));

        responseWriter.emit(HookResponse.forPhase(phase));
    }

    private HookPayload readPayload() {
        BoundedInputReader inputReader = inputReaderProvider.getObject();
        HookPayloadReader payloadReader = payloadReaderProvider.getObject();
        try {
            return payloadReader.read(inputReader.read(stdin.get()));
        } catch (RuntimeException e) {
            log.debug("Unreadable hook payload: {}", e.getMessage());
            return HookPayload.empty();
        }
    }

    static Optional<HookPhase> phaseOf(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        return positional.isEmpty() ? Optional.empty() : HookPhase.parse(positional.get(0));
    }
}
