package com.agentstudio.observability.metrics;

import com.agentstudio.observability.MutableClock;
import com.agentstudio.observability.RunObserverProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for MetricsAggregator.
 */
class MetricsAggregatorTest {

    private MutableClock clock;
    private RunObserverProperties.Metrics config;
    private MetricsAggregator aggregator;
    private RunMetrics metrics;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-06-01T10:00:00Z");
        config = new RunObserverProperties.Metrics();
        aggregator = new MetricsAggregator(config, clock);
        metrics = new RunMetrics();
    }

    // Pre at t, post at t+120ms across two invocations
    @Test
    @DisplayName("Post pairs with the pre event and records the latency")
    void recordEnd_shouldMeasureLatency() {
        aggregator.recordStart(metrics, "developer", "Bash");
        clock.advance(Duration.ofMillis(120));

        assertThat(aggregator.recordEnd(metrics, "developer", "Bash")).hasValue(120L);

        MetricsEntry tool = metrics.getTools().get("Bash");
        assertThat(tool.getCount()).isEqualTo(1);
        assertThat(tool.getTotalMs()).isEqualTo(120);
        assertThat(tool.getMaxMs()).isEqualTo(120);
        assertThat(tool.getLastMs()).isEqualTo(120);
        assertThat(metrics.getAgents().get("developer").getTotalMs()).isEqualTo(120);
        assertThat(metrics.getInFlight()).isEmpty();
    }

    @Test
    @DisplayName("Post without a pending pre records nothing")
    void recordEnd_shouldBeEmpty_whenNoStart() {
        assertThat(aggregator.recordEnd(metrics, "developer", "Bash")).isEmpty();
        assertThat(metrics.getTools()).isEmpty();
    }

    @Test
    @DisplayName("Nested calls of the same tool pair in FIFO order")
    void recordEnd_shouldPairFifo() {
        aggregator.recordStart(metrics, "developer", "Bash");
        clock.advance(Duration.ofMillis(100));
        aggregator.recordStart(metrics, "developer", "Bash");
        clock.advance(Duration.ofMillis(50));

        assertThat(aggregator.recordEnd(metrics, "developer", "Bash")).hasValue(150L);
        assertThat(aggregator.recordEnd(metrics, "developer", "Bash")).hasValue(50L);
        assertThat(metrics.getTools().get("Bash").getCount()).isEqualTo(2);
        assertThat(metrics.getTools().get("Bash").getMaxMs()).isEqualTo(150);
    }

    @Test
    @DisplayName("Clock moving backwards clamps the duration to zero")
    void recordEnd_shouldClampNegativeDurations() {
        aggregator.recordStart(metrics, "developer", "Bash");
        clock.advance(Duration.ofMillis(-500));

        assertThat(aggregator.recordEnd(metrics, "developer", "Bash")).hasValue(0L);
    }

    @Test
    @DisplayName("Start queue per key is bounded")
    void recordStart_shouldCapQueue() {
        config.setMaxInFlightPerKey(2);
        for (int i = 0; i < 5; i++) {
            aggregator.recordStart(metrics, "developer", "Bash");
        }

        assertThat(metrics.getInFlight().get(MetricsAggregator.key("developer", "Bash"))).hasSize(2);
    }

    @Test
    @DisplayName("Pruning keeps the entries with the largest total")
    void prune_shouldKeepTopByTotal() {
        Map<String, MetricsEntry> entries = new LinkedHashMap<>();
        entries.put("Read", new MetricsEntry(1, 10, 10, 10));
        entries.put("Bash", new MetricsEntry(1, 500, 500, 500));
        entries.put("Grep", new MetricsEntry(1, 40, 40, 40));

        Map<String, MetricsEntry> kept = MetricsAggregator.prune(entries, 2);

        assertThat(kept).containsOnlyKeys("Bash", "Grep");
    }

    @Test
    @DisplayName("Rollups never exceed the configured number of entries")
    void recordEnd_shouldPruneRollups() {
        config.setMaxEntries(2);
        for (String tool : new String[]{"Read", "Bash", "Grep"}) {
            aggregator.recordStart(metrics, "developer", tool);
            clock.advance(Duration.ofMillis("Bash".equals(tool) ? 300 : 10));
            aggregator.recordEnd(metrics, "developer", tool);
        }

        assertThat(metrics.getTools()).hasSize(2).containsKey("Bash");
    }
}
