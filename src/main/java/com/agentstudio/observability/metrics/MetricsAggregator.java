package com.agentstudio.observability.metrics;

import com.agentstudio.observability.RunObserverProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Pairs pre/post tool events across process boundaries and maintains bounded latency rollups.
 * <p>
 * Each {@code (agent, tool)} key owns a FIFO of start timestamps: a pre event pushes, a post
 * event pops the oldest. Nested calls of the same tool by the same agent therefore pair in order.
 *
 * @author Agent Studio 2025-2026
 */
public class MetricsAggregator {

    private static final Logger log = LoggerFactory.getLogger(MetricsAggregator.class);

    private static final Comparator<Map.Entry<String, MetricsEntry>> BY_TOTAL_DESC =
            Comparator.comparingLong((Map.Entry<String, MetricsEntry> e) -> e.getValue().getTotalMs()).reversed();

    private final RunObserverProperties.Metrics config;
    private final Clock clock;

    public MetricsAggregator(RunObserverProperties.Metrics config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    static String key(String agent, String tool) {
        return agent + "|" + tool;
    }

    /**
     * Records the start of a tool call.
     */
    public void recordStart(RunMetrics metrics, String agent, String tool) {
        List<Long> queue = metrics.startQueue(key(agent, tool));
        queue.add(clock.millis());
        int cap = Math.max(1, config.getMaxInFlightPerKey());
        while (queue.size() > cap) {
            queue.remove(0);
        }
        pruneInFlightKeys(metrics.getInFlight());
    }

    /**
     * Records the end of a tool call by pairing it with the oldest pending start.
     *
     * @return the measured duration, empty when no start was pending
     */
    public OptionalLong recordEnd(RunMetrics metrics, String agent, String tool) {
        String key = key(agent, tool);
        List<Long> queue = metrics.getInFlight().get(key);
        if (queue == null || queue.isEmpty()) {
            log.debug("No pending start for {}, duration not recorded", key);
            return OptionalLong.empty();
        }
        Long started = queue.remove(0);
        if (queue.isEmpty()) {
            metrics.getInFlight().remove(key);
        }
        long duration = Math.max(0L, clock.millis() - (started == null ? clock.millis() : started));

        metrics.getTools().computeIfAbsent(tool, k -> new MetricsEntry()).record(duration);
        metrics.getAgents().computeIfAbsent(agent, k -> new MetricsEntry()).record(duration);
        metrics.setTools(prune(metrics.getTools(), config.getMaxEntries()));
        metrics.setAgents(prune(metrics.getAgents(), config.getMaxEntries()));
        return OptionalLong.of(duration);
    }

    /**
     * Keeps the top {@code cap} entries by {@code total_ms}. The map is returned unchanged when
     * it is within the cap.
     */
    static Map<String, MetricsEntry> prune(Map<String, MetricsEntry> entries, int cap) {
        int limit = Math.max(1, cap);
        if (entries.size() <= limit) {
            return entries;
        }
        List<Map.Entry<String, MetricsEntry>> sorted = new ArrayList<>(entries.entrySet());
        sorted.sort(BY_TOTAL_DESC);
        Map<String, MetricsEntry> kept = new LinkedHashMap<>();
        for (Map.Entry<String, MetricsEntry> entry : sorted.subList(0, limit)) {
            kept.put(entry.getKey(), entry.getValue());
        }
        log.debug("Pruned metrics map from {} to {} entries", entries.size(), kept.size());
        return kept;
    }

    private void pruneInFlightKeys(Map<String, List<Long>> inFlight) {
        int limit = Math.max(1, config.getMaxEntries());
        Iterator<String> keys = inFlight.keySet().iterator();
        while (inFlight.size() > limit && keys.hasNext()) {
            keys.next();
            keys.remove();
        }
    }
}
