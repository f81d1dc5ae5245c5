package com.agentstudio.observability.hook;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.ByteArrayInputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for BoundedInputReader.
 */
class BoundedInputReaderTest {

    @Test
    @DisplayName("Reads the whole stream up to end of input")
    void read_shouldReadToEnd() {
        BoundedInputReader reader = new BoundedInputReader(Duration.ofMillis(200), Duration.ofSeconds(2), 1024);

        byte[] bytes = reader.read(new ByteArrayInputStream("{\"tool_name\":\"Bash\"}".getBytes(StandardCharsets.UTF_8)));

        assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("{\"tool_name\":\"Bash\"}");
    }

    @Test
    @DisplayName("Stops at the byte cap")
    void read_shouldHonourByteCap() {
        BoundedInputReader reader = new BoundedInputReader(Duration.ofMillis(200), Duration.ofSeconds(2), 10);

        byte[] bytes = reader.read(new ByteArrayInputStream(new byte[100]));

        assertThat(bytes).hasSize(10);
    }

    // Host never writes and never closes stdin
    @Test
    @Timeout(5)
    @DisplayName("Silent stream returns empty after the total timeout")
    void read_shouldGiveUpOnSilentStream() throws Exception {
        BoundedInputReader reader = new BoundedInputReader(Duration.ofMillis(50), Duration.ofMillis(150), 1024);
        try (PipedOutputStream writer = new PipedOutputStream();
             PipedInputStream in = new PipedInputStream(writer)) {

            assertThat(reader.read(in)).isEmpty();
        }
    }

    @Test
    @Timeout(5)
    @DisplayName("Stream that goes idle returns what arrived")
    void read_shouldStopWhenIdle() throws Exception {
        BoundedInputReader reader = new BoundedInputReader(Duration.ofMillis(100), Duration.ofSeconds(3), 1024);
        try (PipedOutputStream writer = new PipedOutputStream();
             PipedInputStream in = new PipedInputStream(writer)) {
            writer.write("{\"partial\":".getBytes(StandardCharsets.UTF_8));
            writer.flush();

            assertThat(new String(reader.read(in), StandardCharsets.UTF_8)).isEqualTo("{\"partial\":");
        }
    }
}
