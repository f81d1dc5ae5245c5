package com.agentstudio.observability.metrics;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Latency rollup for one tool or agent. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MetricsEntry {

    private long count;
    private long totalMs;
    private long maxMs;
    private long lastMs;

    public MetricsEntry() {
    }

    public MetricsEntry(long count, long totalMs, long maxMs, long lastMs) {
        this.count = count;
        this.totalMs = totalMs;
        this.maxMs = maxMs;
        this.lastMs = lastMs;
    }

    /** Adds one observed duration. */
    public void record(long durationMs) {
        count++;
        totalMs += durationMs;
        maxMs = Math.max(maxMs, durationMs);
        lastMs = durationMs;
    }

    public long getCount() {
        return count;
    }

    public void setCount(long count) {
        this.count = count;
    }

    public long getTotalMs() {
        return totalMs;
    }

    public void setTotalMs(long totalMs) {
        this.totalMs = totalMs;
    }

    public long getMaxMs() {
        return maxMs;
    }

    public void setMaxMs(long maxMs) {
        this.maxMs = maxMs;
    }

    public long getLastMs() {
        return lastMs;
    }

    public void setLastMs(long lastMs) {
        this.lastMs = lastMs;
    }
}
