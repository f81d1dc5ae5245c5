package com.agentstudio.observability.payload;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Removes credentials from text and JSON trees before anything is persisted.
 * Provider-specific patterns run before the generic bearer pattern.
 *
 * @author Agent Studio 2025-2026
 */
public class SecretRedactor {

    private record Rule(Pattern pattern, String replacement) {
    }

    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("sk-ant-[a-zA-Z0-9_-]{20,}"), "[REDACTED_ANTHROPIC_KEY]"),
            new Rule(Pattern.compile("sk-[a-zA-Z0-9]{20,}"), "[REDACTED_OPENAI_KEY]"),
            new Rule(Pattern.compile("AIza[a-zA-Z0-9_-]{20,}"), "[REDACTED_GOOGLE_KEY]"),
            new Rule(Pattern.compile("gh[pousr]_[a-zA-Z0-9]{20,}"), "[REDACTED_GITHUB_TOKEN]"),
            new Rule(Pattern.compile("(?:AKIA|ASIA)[A-Z0-9]{16}"), "[REDACTED_AWS_KEY]"),
            new Rule(Pattern.compile("eyJ[a-zA-Z0-9_-]+\\.[a-zA-Z0-9_-]+\\.[a-zA-Z0-9_-]+"), "[REDACTED_JWT]"),
            new Rule(Pattern.compile("(?i)bearer\\s+[a-zA-Z0-9_.~+/=-]{20,}"), "Bearer [REDACTED_TOKEN]"),
            new Rule(Pattern.compile("((?:ANTHROPIC|OPENAI|GEMINI|GOOGLE|GITHUB|GH|NPM|AWS_SECRET_ACCESS|AWS_SESSION)"
                    + "_(?:API_KEY|TOKEN|KEY)?)=\\S+"), "$1=[REDACTED]"));

    private static final Pattern SENSITIVE_KEY = Pattern.compile(
            "(?i).*(api[_-]?key|secret|password|passwd|access[_-]?token|refresh[_-]?token|private[_-]?key).*");

    /**
     * Result of redacting a value.
     */
    public record Redacted<T>(T value, boolean redacted) {
    }

    public Redacted<String> redact(String text) {
        if (text == null || text.isEmpty()) {
            return new Redacted<>(text, false);
        }
        String result = text;
        for (Rule rule : RULES) {
            result = rule.pattern().matcher(result).replaceAll(rule.replacement());
        }
        return new Redacted<>(result, !result.equals(text));
    }

    /**
     * Returns a redacted deep copy of {@code node}. Values under sensitive-looking keys are
     * replaced entirely.
     */
    public Redacted<JsonNode> redact(JsonNode node) {
        if (node == null) {
            return new Redacted<>(null, false);
        }
        boolean[] changed = {false};
        JsonNode copy = copy(node, changed);
        return new Redacted<>(copy, changed[0]);
    }

    private JsonNode copy(JsonNode node, boolean[] changed) {
        if (node.isTextual()) {
            Redacted<String> text = redact(node.asText());
            changed[0] |= text.redacted();
            return TextNode.valueOf(text.value());
        }
        if (node.isObject()) {
            ObjectNode out = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (SENSITIVE_KEY.matcher(field.getKey()).matches() && field.getValue().isValueNode()
                        && !field.getValue().isNull() && !field.getValue().asText().isEmpty()) {
                    out.put(field.getKey(), "[REDACTED]");
                    changed[0] = true;
                } else {
                    out.set(field.getKey(), copy(field.getValue(), changed));
                }
            }
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode();
            for (JsonNode item : node) {
                out.add(copy(item, changed));
            }
            return out;
        }
        return node.deepCopy();
    }
}
