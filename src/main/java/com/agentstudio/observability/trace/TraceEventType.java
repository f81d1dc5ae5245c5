package com.agentstudio.observability.trace;

import com.fasterxml.jackson.annotation.JsonValue;

/** Event type derived from hook phase and tool name. */
public enum TraceEventType {
    AGENT_START("AgentStart"),
    AGENT_STOP("AgentStop"),
    HANDOFF("Handoff"),
    TOOL_CALL_START("ToolCallStart"),
    TOOL_CALL_STOP("ToolCallStop"),
    SPAN_START("SpanStart"),
    SPAN_END("SpanEnd");

    private final String label;

    TraceEventType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
