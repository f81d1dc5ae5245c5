package com.agentstudio.observability.run;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Optional;

/**
 * Recognizes failure signatures in tool results.
 * <p>
 * Markers: {@code is_error}/{@code isError} true, a non-empty {@code error}, {@code success}
 * false, or result text mentioning a hook error or starting with {@code Error:} /
 * {@code Exception}.
 */
public final class FailureDetector {

    static final int MAX_MESSAGE_LENGTH = 500;

    private FailureDetector() {
    }

    /**
     * Returns the failure message when {@code toolResult} carries an error marker.
     */
    public static Optional<String> detect(JsonNode toolResult) {
        if (toolResult == null || toolResult.isNull() || toolResult.isMissingNode()) {
            return Optional.empty();
        }
        if (toolResult.isTextual()) {
            return detectText(toolResult.asText());
        }
        if (!toolResult.isObject()) {
            return Optional.empty();
        }
        if (isTrue(toolResult.get("is_error")) || isTrue(toolResult.get("isError"))) {
            return Optional.of(truncate(describe(toolResult, "tool reported an error")));
        }
        JsonNode error = toolResult.get("error");
        if (error != null && !error.isNull() && !(error.isBoolean() && !error.asBoolean())) {
            String message = error.isValueNode() ? error.asText() : error.toString();
            if (!message.isBlank() && !"false".equals(message)) {
                return Optional.of(truncate(message));
            }
        }
        JsonNode success = toolResult.get("success");
        if (success != null && success.isBoolean() && !success.asBoolean()) {
            return Optional.of(truncate(describe(toolResult, "tool reported success=false")));
        }
        for (String field : new String[]{"content", "output", "stdout", "message"}) {
            JsonNode value = toolResult.get(field);
            if (value != null && value.isTextual()) {
                Optional<String> found = detectText(value.asText());
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    static Optional<String> detectText(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        if (trimmed.toLowerCase(Locale.ROOT).contains("hook error")
                || trimmed.startsWith("Error:")
                || trimmed.startsWith("Exception")) {
            return Optional.of(truncate(trimmed));
        }
        return Optional.empty();
    }

    private static String describe(JsonNode result, String fallback) {
        for (String field : new String[]{"error", "message", "content", "output"}) {
            JsonNode value = result.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return fallback;
    }

    private static boolean isTrue(JsonNode node) {
        return node != null && (node.isBoolean() ? node.asBoolean() : "true".equalsIgnoreCase(node.asText()));
    }

    static String truncate(String message) {
        return message.length() <= MAX_MESSAGE_LENGTH ? message : message.substring(0, MAX_MESSAGE_LENGTH) + "...";
    }
}
