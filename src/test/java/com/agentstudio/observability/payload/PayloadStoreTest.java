package com.agentstudio.observability.payload;

import com.agentstudio.observability.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for PayloadStore.
 */
class PayloadStoreTest {

    private static final String TRACE_ID = "4bf92f3577b34da6a3ce929d0e0e4736";
    private static final String SPAN_ID = "00f067aa0ba902b7";

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private PayloadStore store(int maxBytes) {
        return new PayloadStore(tempDir, maxBytes, new SecretRedactor(), objectMapper,
                MutableClock.at("2025-06-01T10:00:00Z"));
    }

    @Test
    @DisplayName("Payload is stored per trace and span")
    void store_shouldWriteSpanFile() throws Exception {
        PayloadRef ref = store(4096).store(TRACE_ID, SPAN_ID,
                objectMapper.readTree("{\"command\":\"ls\"}"), objectMapper.readTree("\"a.txt\"")).orElseThrow();

        Path expected = tempDir.resolve("trace-" + TRACE_ID).resolve("span-" + SPAN_ID + ".json");
        assertThat(ref.payloadRef()).isEqualTo(expected.toString());
        JsonNode doc = objectMapper.readTree(Files.readString(expected));
        assertThat(doc.path("inputs").path("command").asText()).isEqualTo("ls");
        assertThat(doc.path("outputs").asText()).isEqualTo("a.txt");
        assertThat(doc.path("stored_at").asText()).isEqualTo("2025-06-01T10:00:00Z");
        assertThat(ref.inputsRedacted()).isFalse();
    }

    @Test
    @DisplayName("Oversized values are replaced by a truncated preview")
    void store_shouldTruncateLargeValues() throws Exception {
        String big = "x".repeat(5000);
        PayloadRef ref = store(300).store(TRACE_ID, SPAN_ID,
                objectMapper.createObjectNode().put("content", big), null).orElseThrow();

        JsonNode inputs = objectMapper.readTree(Files.readString(Path.of(ref.payloadRef()))).path("inputs");
        assertThat(inputs.path("truncated").asBoolean()).isTrue();
        assertThat(inputs.path("original_bytes").asInt()).isGreaterThan(5000);
        assertThat(inputs.path("preview").asText()).hasSize(300);
    }

    @Test
    @DisplayName("Missing ids store nothing")
    void store_shouldSkip_withoutIds() {
        assertThat(store(4096).store(null, SPAN_ID, null, null)).isEmpty();
    }
}
