package com.agentstudio.observability.routing;

import com.agentstudio.observability.MutableClock;
import com.agentstudio.observability.TestObserverProperties;
import com.agentstudio.observability.event.ToolEventsMirror;
import com.agentstudio.observability.run.RunPaths;
import com.agentstudio.observability.run.RunState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for RoutingDecisionReader and RoutingHandoffRecorder.
 */
class RoutingHandoffRecorderTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RunPaths paths;
    private RoutingDecisionReader reader;
    private RoutingHandoffRecorder recorder;
    private RunState state;

    @BeforeEach
    void setUp() {
        paths = new RunPaths(TestObserverProperties.rootedAt(tempDir));
        reader = new RoutingDecisionReader(paths, objectMapper);
        recorder = new RoutingHandoffRecorder(paths, new ToolEventsMirror(paths, objectMapper), objectMapper,
                MutableClock.at("2025-06-01T10:00:00Z"));
        state = RunState.createDefault("run-1", "s1", "2025-06-01T10:00:00Z");
    }

    private void writeDecision(String json) throws Exception {
        Path path = paths.routingSessionPath("s1");
        Files.createDirectories(path.getParent());
        Files.writeString(path, json);
    }

    @Nested
    @DisplayName("Decision ingestion")
    class ReaderTests {

        @Test
        @DisplayName("Routing section is copied from the session file")
        void read_shouldIngestDecision() throws Exception {
            writeDecision("{\"routing\":{\"completed\":true,\"completed_at\":\"2025-06-01T09:59:00Z\","
                    + "\"decision\":{\"route\":\"developer\",\"confidence\":0.9},\"handoff_target\":\"developer\"}}");

            RoutingState ingested = reader.read("s1").orElseThrow();
            RoutingDecisionReader.merge(state, ingested);

            assertThat(state.getRouting().isCompleted()).isTrue();
            assertThat(state.getRouting().getHandoffTarget()).isEqualTo("developer");
            assertThat(state.getRouting().getDecision().path("route").asText()).isEqualTo("developer");
        }

        @Test
        @DisplayName("Missing or malformed files are ignored")
        void read_shouldBeEmpty_forUnusableFiles() throws Exception {
            assertThat(reader.read("s1")).isEmpty();

            writeDecision("{ broken");
            assertThat(reader.read("s1")).isEmpty();

            writeDecision("{\"routing\":\"nope\"}");
            assertThat(reader.read("s1")).isEmpty();
        }

        @Test
        @DisplayName("Stale upstream file does not reset a locally completed handoff")
        void merge_shouldKeepLocalOutcome() {
            state.getRouting().setHandoffCompleted(true);
            state.getRouting().setHandoffOutcome(RoutingHandoffRecorder.OUTCOME_PROACTIVE);
            RoutingState stale = new RoutingState();
            stale.setHandoffTarget("developer");

            RoutingDecisionReader.merge(state, stale);

            assertThat(state.getRouting().isHandoffCompleted()).isTrue();
            assertThat(state.getRouting().getHandoffOutcome()).isEqualTo(RoutingHandoffRecorder.OUTCOME_PROACTIVE);
        }
    }

    @Nested
    @DisplayName("Handoff outcome")
    class RecorderTests {

        @BeforeEach
        void routedToDeveloper() {
            state.getRouting().setHandoffTarget("developer");
        }

        @Test
        @DisplayName("Task to the routed target without a denial is proactive")
        void onTaskCompleted_shouldBeProactive() throws Exception {
            assertThat(recorder.onTaskCompleted(state, "Developer")).contains(RoutingHandoffRecorder.OUTCOME_PROACTIVE);

            recorder.writeArtifact(state, "s1");

            JsonNode artifact = objectMapper.readTree(paths.routingHandoffArtifactPath("run-1").toFile());
            assertThat(artifact.path("outcome").asText()).isEqualTo("proactive");
            assertThat(artifact.path("handoff_target").asText()).isEqualTo("developer");
        }

        @Test
        @DisplayName("Task after an enforcement denial is a fallback")
        void onTaskCompleted_shouldBeFallback_afterDenial() throws Exception {
            Path toolEvents = paths.toolEventsPath("run-1");
            Files.createDirectories(toolEvents.getParent());
            Files.writeString(toolEvents, "{\"tool\":\"Task\",\"denied\":true,"
                    + "\"reason\":\"" + RoutingHandoffRecorder.HANDOFF_REQUIRED_MARKER + ": spawn developer\"}\n");

            assertThat(recorder.onTaskCompleted(state, "developer")).contains(RoutingHandoffRecorder.OUTCOME_FALLBACK);
            assertThat(state.getRouting().isHandoffCompleted()).isTrue();
        }

        @Test
        @DisplayName("Handoff completes once and only for the routed target")
        void onTaskCompleted_shouldIgnoreOtherTargets() {
            assertThat(recorder.onTaskCompleted(state, "reviewer")).isEmpty();
            assertThat(recorder.onTaskCompleted(state, "developer")).isPresent();
            assertThat(recorder.onTaskCompleted(state, "developer")).isEmpty();
        }
    }
}
