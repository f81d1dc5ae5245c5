package com.agentstudio.observability.event;

import com.agentstudio.observability.metrics.MetricsEntry;
import com.agentstudio.observability.run.AtomicFiles;
import com.agentstudio.observability.run.RunError;
import com.agentstudio.observability.run.RunPaths;
import com.agentstudio.observability.run.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Renders {@code runs/<run_id>/summary.md}, a human-readable view derived from the run document.
 */
public class RunSummaryWriter {

    private static final Logger log = LoggerFactory.getLogger(RunSummaryWriter.class);

    static final int TOP_TOOLS = 10;
    static final int RECENT_ERRORS = 5;

    private final RunPaths paths;

    public RunSummaryWriter(RunPaths paths) {
        this.paths = paths;
    }

    public void write(RunState state) {
        Path path = paths.summaryPath(state.getRunId());
        try {
            AtomicFiles.write(path, render(state).getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.debug("Unable to write run summary {}: {}", path, e.getMessage());
        }
    }

    String render(RunState state) {
        StringBuilder md = new StringBuilder();
        md.append("# Run ").append(state.getRunId()).append("\n\n");
        md.append("- Status: ").append(state.getStatus() == null ? "running" : state.getStatus().value()).append('\n');
        md.append("- Session: ").append(orDash(state.getSessionKey())).append('\n');
        md.append("- Current agent: ").append(orDash(state.getCurrentAgent())).append('\n');
        md.append("- Current activity: ").append(orDash(state.getCurrentActivity())).append('\n');
        md.append("- Step: ").append(state.getCurrentStep()).append('\n');
        md.append("- Started: ").append(orDash(state.getStartedAt())).append('\n');
        md.append("- Last event: ").append(orDash(state.getLastEventAt())).append('\n');
        md.append("- Events: ").append(state.getEventsCount()).append('\n');
        if (state.getTrace().getRoot() != null) {
            md.append("- Trace: `").append(state.getTrace().getRoot().traceId()).append("`\n");
        }

        appendTable(md, "Agents", "Agent", state.getMetrics().getAgents(), Integer.MAX_VALUE);
        appendTable(md, "Top tools by latency", "Tool", state.getMetrics().getTools(), TOP_TOOLS);

        List<RunError> errors = state.getErrors();
        if (!errors.isEmpty()) {
            md.append("\n## Recent errors\n\n");
            for (RunError error : errors.subList(Math.max(0, errors.size() - RECENT_ERRORS), errors.size())) {
                md.append("- ").append(orDash(error.at())).append(' ')
                        .append(orDash(error.agent())).append('/').append(orDash(error.tool()))
                        .append(": ").append(orDash(error.message()).replace('\n', ' ')).append('\n');
            }
        }
        return md.toString();
    }

    private static void appendTable(StringBuilder md, String title, String column,
                                    Map<String, MetricsEntry> entries, int limit) {
        if (entries.isEmpty()) {
            return;
        }
        List<Map.Entry<String, MetricsEntry>> sorted = new ArrayList<>(entries.entrySet());
        sorted.sort(Comparator.comparingLong((Map.Entry<String, MetricsEntry> e) -> e.getValue().getTotalMs()).reversed());
        md.append("\n## ").append(title).append("\n\n");
        md.append("| ").append(column).append(" | Calls | Total ms | Avg ms | Max ms |\n");
        md.append("|---|---:|---:|---:|---:|\n");
        for (Map.Entry<String, MetricsEntry> entry : sorted.subList(0, Math.min(limit, sorted.size()))) {
            MetricsEntry m = entry.getValue();
            long avg = m.getCount() == 0 ? 0 : m.getTotalMs() / m.getCount();
            md.append("| ").append(entry.getKey()).append(" | ").append(m.getCount()).append(" | ")
                    .append(m.getTotalMs()).append(" | ").append(avg).append(" | ").append(m.getMaxMs()).append(" |\n");
        }
    }

    private static String orDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }
}
