package com.agentstudio.observability.trace;

/**
 * Span chosen for one invocation by the {@link TraceReconstructor}.
 *
 * @param agent        agent the event is attributed to
 * @param spanId       span of this event
 * @param parentSpanId parent span, null for root-level events; never equal to {@code spanId}
 * @param kind         coarse span kind
 * @param eventType    event type
 */
public record SpanAssignment(
        String agent,
        String spanId,
        String parentSpanId,
        SpanKind kind,
        TraceEventType eventType) {

    public SpanAssignment {
        if (parentSpanId != null && parentSpanId.equals(spanId)) {
            parentSpanId = null;
        }
    }
}
