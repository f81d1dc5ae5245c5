package com.agentstudio.observability.trace;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapGetter;
import io.opentelemetry.sdk.trace.IdGenerator;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import io.opentelemetry.sdk.trace.samplers.SamplingDecision;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Trace and span id generation, sampling and W3C {@code traceparent} encoding,
 * delegated to the OpenTelemetry API/SDK.
 */
public class TraceIds {

    private static final String TRACEPARENT = "traceparent";

    private static final TextMapGetter<Map<String, String>> MAP_GETTER = new TextMapGetter<>() {
        @Override
        public Iterable<String> keys(Map<String, String> carrier) {
            return carrier.keySet();
        }

        @Override
        public String get(Map<String, String> carrier, String key) {
            return carrier == null ? null : carrier.get(key);
        }
    };

    private final IdGenerator idGenerator;
    private final Sampler sampler;

    /**
     * Creates id support with random ids.
     *
     * @param sampleRatio fraction of traces marked sampled
     */
    public TraceIds(double sampleRatio) {
        this(IdGenerator.random(), sampleRatio);
    }

    public TraceIds(IdGenerator idGenerator, double sampleRatio) {
        this.idGenerator = idGenerator;
        this.sampler = Sampler.traceIdRatioBased(Math.max(0.0, Math.min(1.0, sampleRatio)));
    }

    public String newTraceId() {
        return idGenerator.generateTraceId();
    }

    public String newSpanId() {
        return idGenerator.generateSpanId();
    }

    /** Sampling decision for a new root trace. */
    public boolean shouldSample(String traceId) {
        SamplingDecision decision = sampler.shouldSample(
                Context.root(),
                traceId,
                "run",
                io.opentelemetry.api.trace.SpanKind.INTERNAL,
                Attributes.empty(),
                Collections.emptyList()).getDecision();
        return decision == SamplingDecision.RECORD_AND_SAMPLE;
    }

    /**
     * Encodes a W3C traceparent header value.
     *
     * @return the header value, or null when the ids are not valid W3C ids
     */
    public static String traceparent(String traceId, String spanId, boolean sampled) {
        if (traceId == null || spanId == null) {
            return null;
        }
        SpanContext spanContext = SpanContext.create(
                traceId,
                spanId,
                sampled ? TraceFlags.getSampled() : TraceFlags.getDefault(),
                TraceState.getDefault());
        Map<String, String> carrier = new HashMap<>();
        W3CTraceContextPropagator.getInstance()
                .inject(Context.root().with(Span.wrap(spanContext)), carrier, Map::put);
        return carrier.get(TRACEPARENT);
    }

    /**
     * Parses a W3C traceparent header value.
     *
     * @return the remote span context, empty when the value is missing or malformed
     */
    public static Optional<SpanContext> parseTraceparent(String traceparent) {
        if (traceparent == null || traceparent.isBlank()) {
            return Optional.empty();
        }
        Context extracted = W3CTraceContextPropagator.getInstance()
                .extract(Context.root(), Map.of(TRACEPARENT, traceparent.trim()), MAP_GETTER);
        SpanContext spanContext = Span.fromContext(extracted).getSpanContext();
        return spanContext.isValid() ? Optional.of(spanContext) : Optional.empty();
    }
}
