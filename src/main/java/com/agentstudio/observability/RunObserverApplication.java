package com.agentstudio.observability;

import com.agentstudio.observability.hook.BoundedInputReader;
import com.agentstudio.observability.hook.HookPayloadReader;
import com.agentstudio.observability.hook.HookPhase;
import com.agentstudio.observability.hook.HookResponse;
import com.agentstudio.observability.hook.HookResponseWriter;
import com.agentstudio.observability.hook.InvocationDeadline;
import com.agentstudio.observability.hook.RunObserverHook;
import io.micrometer.observation.ObservationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.Banner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;

/**
 * Command-line entry point: {@code run-observer <phase>}.
 * <p>
 * Exactly one response line is written to stdout, whatever happens. The deadline watchdog,
 * the normal path and the final fallback all go through the same {@link HookResponseWriter}.
 *
 * @author Agent Studio 2025-2026
 */
@SpringBootApplication
@EnableConfigurationProperties(RunObserverProperties.class)
public class RunObserverApplication {

    private static final Logger log = LoggerFactory.getLogger(RunObserverApplication.class);

    public static void main(String[] args) {
        HookPhase phase = args.length > 0 ? HookPhase.parse(args[0]).orElse(null) : null;
        HookResponseWriter writer = new HookResponseWriter(System.out, HookResponse.forPhase(phase));
        InvocationDeadline deadline = new InvocationDeadline(
                InvocationDeadline.timeoutFrom(System.getenv(InvocationDeadline.TIMEOUT_VARIABLE)), writer).arm();
        try (ConfigurableApplicationContext ignored = new SpringApplicationBuilder(RunObserverApplication.class)
                .web(WebApplicationType.NONE)
                .bannerMode(Banner.Mode.OFF)
                .logStartupInfo(false)
                .initializers(context -> {
                    context.getBeanFactory().registerSingleton("hookResponseWriter", writer);
                    context.getBeanFactory().registerSingleton("invocationDeadline", deadline);
                })
                .run(args)) {
            log.debug("Hook invocation complete");
        } catch (Exception e) {
            log.warn("Run observer could not start: {}", e.toString());
        } finally {
            writer.emitDefault();
            deadline.close();
        }
    }

    @Bean
    public RunObserverRunner runObserverRunner(RunObserverProperties properties,
                                               ObjectProvider<RunObserverHook> hookProvider,
                                               ObjectProvider<HookPayloadReader> payloadReaderProvider,
                                               ObjectProvider<BoundedInputReader> inputReaderProvider,
                                               ObjectProvider<ObservationRegistry> observationRegistryProvider,
                                               ObjectProvider<LoggingSystem> loggingSystemProvider,
                                               HookResponseWriter hookResponseWriter) {
        return new RunObserverRunner(properties, hookProvider, payloadReaderProvider, inputReaderProvider,
                observationRegistryProvider, hookResponseWriter,
                loggingSystemProvider.getIfAvailable(), () -> System.in);
    }
}
