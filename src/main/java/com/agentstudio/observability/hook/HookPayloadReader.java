package com.agentstudio.observability.hook;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw hook stdin into a {@link HookPayload}.
 * <p>
 * The top-level object is streamed with a {@link JsonParser}: values of unknown fields are
 * skipped and parsing stops once every field group has been seen. When the input is not
 * valid JSON (truncated by the byte cap, or garbage) whatever was streamed is kept and the
 * remaining string fields are recovered from a bounded prefix with literal-field regexes.
 *
 * @author Agent Studio 2025-2026
 */
public class HookPayloadReader {

    private static final Logger log = LoggerFactory.getLogger(HookPayloadReader.class);

    private static final int FALLBACK_PREFIX_CHARS = 64 * 1024;

    enum Field {
        TOOL(List.of("tool_name", "tool", "toolName", "name")),
        INPUT(List.of("tool_input", "toolInput", "input", "params")),
        RESULT(List.of("tool_result", "toolResult", "result", "tool_response")),
        CONTEXT(List.of("context", "ctx")),
        SESSION(List.of("session_id", "sessionId", "conversation_id", "conversationId", "chat_id", "chatId")),
        AGENT(List.of("agent_name", "agentName", "agent", "agent_type", "subagent_name"));

        private final List<String> aliases;

        Field(List<String> aliases) {
            this.aliases = aliases;
        }

        List<String> aliases() {
            return aliases;
        }
    }

    private static final List<String> DELEGATE_ALIASES = List.of("subagent_type", "agent", "agent_name", "subagentType");
    private static final List<String> FILE_ALIASES = List.of("file_path", "path", "notebook_path", "filePath");

    private static final Map<String, Field> FIELD_BY_ALIAS = new HashMap<>();

    static {
        for (Field field : Field.values()) {
            for (String alias : field.aliases()) {
                FIELD_BY_ALIAS.put(alias, field);
            }
        }
    }

    private final ObjectMapper objectMapper;

    public HookPayloadReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a payload. Never throws: unusable input yields {@link HookPayload#empty()}.
     */
    public HookPayload read(byte[] input) {
        if (input == null || input.length == 0) {
            return HookPayload.empty();
        }
        Map<String, JsonNode> found = new HashMap<>();
        boolean complete = stream(input, found);
        if (!complete) {
            recoverStrings(new String(input, 0, Math.min(input.length, FALLBACK_PREFIX_CHARS), StandardCharsets.UTF_8),
                    found);
        }
        return normalize(found, !complete);
    }

    private boolean stream(byte[] input, Map<String, JsonNode> found) {
        try (JsonParser parser = objectMapper.getFactory().createParser(input)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                return false;
            }
            EnumMap<Field, Boolean> seen = new EnumMap<>(Field.class);
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String name = parser.currentName();
                parser.nextToken();
                Field field = FIELD_BY_ALIAS.get(name);
                if (field == null || found.containsKey(name)) {
                    parser.skipChildren();
                    continue;
                }
                found.put(name, objectMapper.readTree(parser));
                seen.put(field, Boolean.TRUE);
                if (seen.size() == Field.values().length) {
                    break;
                }
            }
            return true;
        } catch (IOException e) {
            log.debug("Payload is not valid JSON, using fallback extraction: {}", e.getMessage());
            return false;
        }
    }

    private static void recoverStrings(String prefix, Map<String, JsonNode> found) {
        for (Field field : List.of(Field.TOOL, Field.SESSION, Field.AGENT)) {
            for (String alias : field.aliases()) {
                if (!found.containsKey(alias)) {
                    String value = literalField(prefix, alias);
                    if (value != null) {
                        found.put(alias, TextNode.valueOf(value));
                    }
                }
            }
        }
        for (String alias : List.of("subagent_type", "subagentType")) {
            String value = literalField(prefix, alias);
            if (value != null) {
                found.putIfAbsent("delegate:" + alias, TextNode.valueOf(value));
            }
        }
        for (String alias : FILE_ALIASES) {
            String value = literalField(prefix, alias);
            if (value != null) {
                found.putIfAbsent("file:" + alias, TextNode.valueOf(value));
            }
        }
    }

    static String literalField(String text, String name) {
        Matcher m = Pattern.compile("\"" + Pattern.quote(name) + "\"\\s*:\\s*\"((?:[^\"\\\\]|\\\\.)*)\"").matcher(text);
        if (!m.find()) {
            return null;
        }
        String value = m.group(1).replace("\\\"", "\"").replace("\\\\", "\\").trim();
        return value.isEmpty() ? null : value;
    }

    private HookPayload normalize(Map<String, JsonNode> found, boolean degraded) {
        JsonNode toolInput = firstNode(found, Field.INPUT.aliases());
        JsonNode toolResult = firstNode(found, Field.RESULT.aliases());
        JsonNode context = firstNode(found, Field.CONTEXT.aliases());

        String sessionId = firstText(found, Field.SESSION.aliases());
        if (sessionId == null) {
            sessionId = textIn(context, Field.SESSION.aliases());
        }
        String agentName = firstText(found, Field.AGENT.aliases());
        if (agentName == null) {
            agentName = textIn(context, Field.AGENT.aliases());
        }
        String delegated = textIn(toolInput, DELEGATE_ALIASES);
        if (delegated == null) {
            delegated = firstText(found, List.of("delegate:subagent_type", "delegate:subagentType"));
        }
        String filePath = textIn(toolInput, FILE_ALIASES);
        if (filePath == null) {
            filePath = firstText(found, List.of("file:file_path", "file:path", "file:notebook_path", "file:filePath"));
        }
        return new HookPayload(firstText(found, Field.TOOL.aliases()), toolInput, toolResult, context,
                sessionId, agentName, delegated, filePath, degraded);
    }

    private static JsonNode firstNode(Map<String, JsonNode> found, List<String> aliases) {
        for (String alias : aliases) {
            JsonNode node = found.get(alias);
            if (node != null && !node.isNull() && !node.isMissingNode()) {
                return node;
            }
        }
        return null;
    }

    private static String firstText(Map<String, JsonNode> found, List<String> aliases) {
        for (String alias : aliases) {
            String value = text(found.get(alias));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String textIn(JsonNode object, List<String> aliases) {
        if (object == null || !object.isObject()) {
            return null;
        }
        for (String alias : aliases) {
            String value = text(object.get(alias));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode node) {
        if (node == null || !node.isValueNode() || node.isNull()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }
}
