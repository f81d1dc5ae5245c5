package com.agentstudio.observability.trace;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Coarse classification of an emitted span. */
public enum SpanKind {
    AGENT,
    TOOL,
    ROUTER,
    ARTIFACT,
    CHAIN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
