package com.agentstudio.observability.run;

import com.agentstudio.observability.MutableClock;
import com.agentstudio.observability.TestObserverProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for RunStateStore.
 */
class RunStateStoreTest {

    private static final String RUN_ID = "run-20250601-100000-abcdefabcdef";

    @TempDir
    Path projectDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RunPaths paths;
    private RunStateStore store;

    @BeforeEach
    void setUp() {
        paths = new RunPaths(TestObserverProperties.rootedAt(projectDir));
        store = new RunStateStore(paths, objectMapper, 2, MutableClock.at("2025-06-01T10:00:00Z"));
    }

    @Nested
    @DisplayName("Reading")
    class ReadTests {

        @Test
        @DisplayName("Missing document yields a fresh running run")
        void read_shouldReturnDefault_whenMissing() {
            RunState state = store.read(RUN_ID, "s1");

            assertThat(state.getRunId()).isEqualTo(RUN_ID);
            assertThat(state.getSessionKey()).isEqualTo("s1");
            assertThat(state.getStatus()).isEqualTo(RunStatus.RUNNING);
            assertThat(state.getStartedAt()).isEqualTo("2025-06-01T10:00:00Z");
            assertThat(state.getEventsCount()).isZero();
        }

        @Test
        @DisplayName("Malformed document yields a fresh run instead of an error")
        void read_shouldReturnDefault_whenMalformed() throws Exception {
            Files.createDirectories(paths.runDir(RUN_ID));
            Files.writeString(paths.statePath(RUN_ID), "{\"run_id\": ");

            RunState state = store.read(RUN_ID, "s1");

            assertThat(state.getRunId()).isEqualTo(RUN_ID);
            assertThat(state.getErrors()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Writing")
    class WriteTests {

        @Test
        @DisplayName("Update persists the mutation and bumps the revision")
        void update_shouldPersistMutation() throws Exception {
            store.update(RUN_ID, "s1", state -> {
                state.setCurrentAgent("developer");
                return null;
            });
            store.update(RUN_ID, "s1", state -> {
                state.setCurrentStep(state.getCurrentStep() + 1);
                return null;
            });

            RunState state = store.read(RUN_ID, "s1");
            assertThat(state.getCurrentAgent()).isEqualTo("developer");
            assertThat(state.getCurrentStep()).isEqualTo(1);
            assertThat(state.getRevision()).isEqualTo(2);
        }

        @Test
        @DisplayName("Document uses snake_case field names")
        void update_shouldWriteSnakeCase() throws Exception {
            store.update(RUN_ID, "s1", state -> {
                state.setCurrentAgent("developer");
                return null;
            });

            JsonNode json = objectMapper.readTree(paths.statePath(RUN_ID).toFile());
            assertThat(json.get("run_id").asText()).isEqualTo(RUN_ID);
            assertThat(json.get("current_agent").asText()).isEqualTo("developer");
            assertThat(json.get("status").asText()).isEqualTo("running");
            assertThat(json.has("events_count")).isTrue();
        }

        @Test
        @DisplayName("Fields written by other tools survive a read-modify-write")
        void update_shouldPreserveUnknownFields() throws Exception {
            Files.createDirectories(paths.runDir(RUN_ID));
            Files.writeString(paths.statePath(RUN_ID),
                    "{\"run_id\":\"" + RUN_ID + "\",\"status\":\"running\",\"custom_tool\":{\"score\":3}}");

            store.update(RUN_ID, "s1", state -> {
                state.setCurrentActivity("Bash");
                return null;
            });

            JsonNode json = objectMapper.readTree(paths.statePath(RUN_ID).toFile());
            assertThat(json.path("custom_tool").path("score").asInt()).isEqualTo(3);
            assertThat(json.get("current_activity").asText()).isEqualTo("Bash");
        }

        @Test
        @DisplayName("A concurrent commit makes the mutation re-apply on fresh state")
        void update_shouldReapply_whenAnotherWriterCommitted() throws Exception {
            RunStateStore other = new RunStateStore(paths, objectMapper, 0, MutableClock.at("2025-06-01T10:00:00Z"));
            AtomicInteger applications = new AtomicInteger();

            store.update(RUN_ID, "s1", state -> {
                if (applications.getAndIncrement() == 0) {
                    try {
                        other.update(RUN_ID, "s1", concurrent -> {
                            concurrent.setCurrentStep(7);
                            return null;
                        });
                    } catch (Exception e) {
                        throw new IllegalStateException(e);
                    }
                }
                state.setCurrentActivity("mine");
                return null;
            });

            RunState state = store.read(RUN_ID, "s1");
            assertThat(applications.get()).isEqualTo(2);
            assertThat(state.getCurrentStep()).isEqualTo(7);
            assertThat(state.getCurrentActivity()).isEqualTo("mine");
            assertThat(state.getRevision()).isEqualTo(2);
        }

        @Test
        @DisplayName("Write failure propagates and leaves no temp file behind")
        void update_shouldPropagateWriteFailure() throws Exception {
            // a regular file where the run directory should be
            Files.createDirectories(paths.runDir(RUN_ID).getParent());
            Files.writeString(paths.runDir(RUN_ID), "not a directory");

            assertThatThrownBy(() -> store.update(RUN_ID, "s1", state -> null))
                    .isInstanceOf(IOException.class);
        }
    }
}
