package com.agentstudio.observability;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for RunObserverProperties configuration.
 */
class RunObserverPropertiesTest {

    // Test default values are correctly set
    @Test
    void defaultValues_shouldBeCorrect() {
        RunObserverProperties props = new RunObserverProperties();

        assertThat(props.isEnabled()).isTrue();
        assertThat(props.isDebug()).isFalse();
        assertThat(props.getRuntimeDir()).isEqualTo(".claude/context/runtime");
        assertThat(props.getDefaultAgent()).isEqualTo("main");
        assertThat(props.getSessionEnvVariables())
                .containsExactly("CLAUDE_SESSION_ID", "CLAUDE_CONVERSATION_ID", "CLAUDE_CHAT_ID");
    }

    // Test bounded collections default to their caps
    @Test
    void caps_shouldHaveCorrectDefaults() {
        RunObserverProperties props = new RunObserverProperties();

        assertThat(props.getDelegation().getMaxPending()).isEqualTo(20);
        assertThat(props.getDelegation().getMaxParentStack()).isEqualTo(20);
        assertThat(props.getMetrics().getMaxEntries()).isEqualTo(50);
        assertThat(props.getMetrics().getMaxInFlightPerKey()).isEqualTo(20);
        assertThat(props.getEvents().getMaxErrors()).isEqualTo(20);
    }

    // Test time and size limits
    @Test
    void limits_shouldHaveCorrectDefaults() {
        RunObserverProperties props = new RunObserverProperties();

        assertThat(props.getSession().getSharedKeyTtl()).isEqualTo(Duration.ofHours(4));
        assertThat(props.getDelegation().getTtl()).isEqualTo(Duration.ofMinutes(3));
        assertThat(props.getEvents().getRotateBytes()).isEqualTo(5L * 1024 * 1024);
        assertThat(props.getEvents().getRotateEvery()).isEqualTo(25);
        assertThat(props.getInput().getIdleTimeout()).isEqualTo(Duration.ofMillis(150));
        assertThat(props.getInput().getTotalTimeout()).isEqualTo(Duration.ofMillis(1000));
        assertThat(props.getInput().getMaxBytes()).isEqualTo(512 * 1024);
        assertThat(props.getTrace().getSampleRatio()).isEqualTo(1.0);
    }

    // Optional channels are off by default
    @Test
    void optionalChannels_shouldBeDisabledByDefault() {
        RunObserverProperties props = new RunObserverProperties();

        assertThat(props.getPayloads().isEnabled()).isFalse();
        assertThat(props.getFailureBundles().isEnabled()).isFalse();
        assertThat(props.getArtifacts().getAgentTasksDir()).isEmpty();
        assertThat(props.getToolEvents().isEnabled()).isTrue();
    }

    // Test setters work correctly
    @Test
    void setters_shouldUpdateValues() {
        RunObserverProperties props = new RunObserverProperties();

        props.setEnabled(false);
        props.setDefaultAgent("orchestrator");
        props.getDelegation().setTtl(Duration.ofSeconds(30));
        props.getEvents().setRotateEvery(5);

        assertThat(props.isEnabled()).isFalse();
        assertThat(props.getDefaultAgent()).isEqualTo("orchestrator");
        assertThat(props.getDelegation().getTtl()).isEqualTo(Duration.ofSeconds(30));
        assertThat(props.getEvents().getRotateEvery()).isEqualTo(5);
    }
}
