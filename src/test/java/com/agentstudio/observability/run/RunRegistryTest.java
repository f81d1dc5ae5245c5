package com.agentstudio.observability.run;

import com.agentstudio.observability.MutableClock;
import com.agentstudio.observability.TestObserverProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for RunRegistry.
 */
class RunRegistryTest {

    @TempDir
    Path projectDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RunPaths paths;
    private RunRegistry registry;

    @BeforeEach
    void setUp() {
        paths = new RunPaths(TestObserverProperties.rootedAt(projectDir));
        registry = new RunRegistry(paths, objectMapper, MutableClock.at("2025-06-01T10:15:30Z"));
    }

    @Test
    @DisplayName("New run id follows run-<date>-<time>-<12 hex>")
    void resolveRunId_shouldCreateWellFormedId() {
        String runId = registry.resolveRunId("s1");

        assertThat(runId).matches("run-20250601-101530-[0-9a-f]{12}");
    }

    @Test
    @DisplayName("Lookup is idempotent per session")
    void resolveRunId_shouldBeIdempotent() throws Exception {
        String first = registry.resolveRunId("s1");
        String second = registry.resolveRunId("s1");

        assertThat(second).isEqualTo(first);
        JsonNode mapping = objectMapper.readTree(paths.sessionMappingPath("s1").toFile());
        assertThat(mapping.get("run_id").asText()).isEqualTo(first);
        assertThat(mapping.get("session_key").asText()).isEqualTo("s1");
        assertThat(mapping.get("created_at").asText()).isEqualTo("2025-06-01T10:15:30Z");
    }

    @Test
    @DisplayName("Different sessions get different runs")
    void resolveRunId_shouldSeparateSessions() {
        assertThat(registry.resolveRunId("s1")).isNotEqualTo(registry.resolveRunId("s2"));
    }

    @Test
    @DisplayName("Concurrent first invocations agree on one run id")
    void resolveRunId_shouldConvergeUnderRace() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<String>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                tasks.add(() -> registry.resolveRunId("raced"));
            }
            Set<String> ids = new HashSet<>();
            for (Future<String> future : pool.invokeAll(tasks)) {
                ids.add(future.get());
            }
            assertThat(ids).hasSize(1);
            assertThat(registry.findRunId("raced")).contains(ids.iterator().next());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Unreadable mapping is replaced and then stable")
    void resolveRunId_shouldRepairCorruptMapping() throws Exception {
        Path mapping = paths.sessionMappingPath("s1");
        Files.createDirectories(mapping.getParent());
        Files.writeString(mapping, "{broken");

        String runId = registry.resolveRunId("s1");

        assertThat(runId).startsWith("run-");
        assertThat(registry.resolveRunId("s1")).isEqualTo(runId);
    }

    @Test
    @DisplayName("Existing mapping with an unsafe run id is not trusted")
    void findRunId_shouldRejectUnsafeIds() throws Exception {
        Path mapping = paths.sessionMappingPath("s1");
        Files.createDirectories(mapping.getParent());
        Files.writeString(mapping, "{\"run_id\":\"../../etc\",\"session_key\":\"s1\"}");

        assertThat(registry.findRunId("s1")).isEmpty();
    }
}
