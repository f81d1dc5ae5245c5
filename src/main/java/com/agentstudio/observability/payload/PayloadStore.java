package com.agentstudio.observability.payload;

import com.agentstudio.observability.run.AtomicFiles;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Stores sanitized tool inputs and outputs per span at
 * {@code <payloads-dir>/trace-<trace_id>/span-<span_id>.json}.
 * Secrets are redacted and oversized values truncated before writing.
 *
 * @author Agent Studio 2025-2026
 */
public class PayloadStore {

    private static final Logger log = LoggerFactory.getLogger(PayloadStore.class);

    private final Path payloadsDir;
    private final int maxBytes;
    private final SecretRedactor redactor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PayloadStore(Path payloadsDir, int maxBytes, SecretRedactor redactor, ObjectMapper objectMapper,
                        Clock clock) {
        this.payloadsDir = payloadsDir;
        this.maxBytes = Math.max(256, maxBytes);
        this.redactor = redactor;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Stores the payload of one span.
     *
     * @return a reference for the event, empty when the write failed
     */
    public Optional<PayloadRef> store(String traceId, String spanId, JsonNode inputs, JsonNode outputs) {
        if (traceId == null || spanId == null) {
            return Optional.empty();
        }
        SecretRedactor.Redacted<JsonNode> in = redactor.redact(inputs);
        SecretRedactor.Redacted<JsonNode> out = redactor.redact(outputs);

        ObjectNode doc = objectMapper.createObjectNode();
        doc.put("trace_id", traceId);
        doc.put("span_id", spanId);
        doc.put("stored_at", Instant.now(clock).toString());
        doc.set("inputs", truncate(in.value()));
        doc.set("outputs", truncate(out.value()));
        doc.put("inputs_redacted", in.redacted());
        doc.put("outputs_redacted", out.redacted());

        Path path = payloadsDir.resolve("trace-" + traceId).resolve("span-" + spanId + ".json");
        try {
            AtomicFiles.write(path, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(doc));
            return Optional.of(new PayloadRef(path.toString(), in.redacted(), out.redacted()));
        } catch (IOException e) {
            log.debug("Unable to store payload {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private JsonNode truncate(JsonNode node) {
        if (node == null) {
            return null;
        }
        String serialized = node.toString();
        byte[] bytes = serialized.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= maxBytes) {
            return node;
        }
        ObjectNode truncated = objectMapper.createObjectNode();
        truncated.put("truncated", true);
        truncated.put("original_bytes", bytes.length);
        truncated.set("preview", TextNode.valueOf(new String(bytes, 0, maxBytes, StandardCharsets.UTF_8)));
        return truncated;
    }
}
