package com.agentstudio.observability.hook;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for HookPayloadReader.
 */
class HookPayloadReaderTest {

    private final HookPayloadReader reader = new HookPayloadReader(new ObjectMapper());

    private HookPayload read(String json) {
        return reader.read(json.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("Well-formed payloads")
    class WellFormedTests {

        @Test
        @DisplayName("Host field names are normalized")
        void read_shouldNormalizeHostFields() {
            HookPayload payload = read("{\"session_id\":\"abc\",\"tool_name\":\"Task\","
                    + "\"tool_input\":{\"subagent_type\":\"developer\",\"prompt\":\"go\"},"
                    + "\"tool_response\":\"done\"}");

            assertThat(payload.toolName()).isEqualTo("Task");
            assertThat(payload.sessionId()).isEqualTo("abc");
            assertThat(payload.delegatedAgent()).isEqualTo("developer");
            assertThat(payload.toolResult().asText()).isEqualTo("done");
            assertThat(payload.degraded()).isFalse();
        }

        @Test
        @DisplayName("Aliases and context hints are honoured")
        void read_shouldAcceptAliases() {
            HookPayload payload = read("{\"tool\":\"Write\",\"input\":{\"file_path\":\"/tmp/a.md\"},"
                    + "\"ctx\":{\"conversationId\":\"c-1\",\"agentName\":\"planner\"}}");

            assertThat(payload.toolName()).isEqualTo("Write");
            assertThat(payload.filePath()).isEqualTo("/tmp/a.md");
            assertThat(payload.sessionId()).isEqualTo("c-1");
            assertThat(payload.agentName()).isEqualTo("planner");
        }

        @Test
        @DisplayName("Unknown fields are skipped")
        void read_shouldSkipUnknownFields() {
            HookPayload payload = read("{\"transcript\":{\"huge\":[1,2,3]},\"hook_event_name\":\"PreToolUse\","
                    + "\"tool_name\":\"Bash\",\"tool_input\":{\"command\":\"ls\"}}");

            assertThat(payload.toolName()).isEqualTo("Bash");
            assertThat(payload.toolInput().path("command").asText()).isEqualTo("ls");
            assertThat(payload.delegatedAgent()).isNull();
        }

        @Test
        @DisplayName("Blank values count as absent")
        void read_shouldTreatBlankAsAbsent() {
            HookPayload payload = read("{\"session_id\":\"  \",\"agent_name\":\"\"}");

            assertThat(payload.sessionId()).isNull();
            assertThat(payload.agentName()).isNull();
            assertThat(payload.hasTool()).isFalse();
        }
    }

    @Nested
    @DisplayName("Degraded payloads")
    class DegradedTests {

        @Test
        @DisplayName("Empty input yields an empty payload")
        void read_shouldReturnEmpty_forNoInput() {
            assertThat(reader.read(new byte[0])).isEqualTo(HookPayload.empty());
            assertThat(reader.read(null)).isEqualTo(HookPayload.empty());
        }

        @Test
        @DisplayName("Truncated JSON keeps recoverable string fields")
        void read_shouldRecoverFromTruncatedJson() {
            HookPayload payload = read("{\"session_id\":\"abc\",\"tool_name\":\"Task\","
                    + "\"tool_input\":{\"subagent_type\":\"reviewer\",\"prompt\":\"very long prompt that got cut");

            assertThat(payload.degraded()).isTrue();
            assertThat(payload.sessionId()).isEqualTo("abc");
            assertThat(payload.toolName()).isEqualTo("Task");
            assertThat(payload.delegatedAgent()).isEqualTo("reviewer");
        }

        @Test
        @DisplayName("Garbage input is tolerated")
        void read_shouldTolerateGarbage() {
            HookPayload payload = read("definitely not json");

            assertThat(payload.degraded()).isTrue();
            assertThat(payload.toolName()).isNull();
        }

        @Test
        @DisplayName("Escaped quotes in recovered fields are unescaped")
        void literalField_shouldUnescape() {
            assertThat(HookPayloadReader.literalField("{\"agent\": \"say \\\"hi\\\"\"", "agent")).isEqualTo("say \"hi\"");
            assertThat(HookPayloadReader.literalField("{\"agent\": 3}", "agent")).isNull();
        }
    }
}
