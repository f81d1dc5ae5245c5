package com.agentstudio.observability.run;

import com.agentstudio.observability.RunObserverProperties;
import com.agentstudio.observability.session.SessionKeys;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Filesystem layout of the runtime root and the side-channel directories.
 *
 * <pre>
 * &lt;runtime&gt;/sessions/&lt;safe-session-id&gt;.json
 * &lt;runtime&gt;/runs/&lt;run_id&gt;/state.json
 * &lt;runtime&gt;/runs/&lt;run_id&gt;/events.ndjson (+ events.ndjson.1)
 * &lt;runtime&gt;/runs/&lt;run_id&gt;/summary.md
 * &lt;runtime&gt;/last-run.json
 * </pre>
 */
public class RunPaths {

    public static final String STATE_FILE = "state.json";
    public static final String EVENTS_FILE = "events.ndjson";
    public static final String SUMMARY_FILE = "summary.md";
    public static final String LAST_RUN_FILE = "last-run.json";
    public static final String SHARED_SESSION_KEY_FILE = "shared-session-key.json";

    private final RunObserverProperties properties;

    public RunPaths(RunObserverProperties properties) {
        this.properties = properties;
    }

    public Path runtimeRoot() {
        return resolve(properties.getRuntimeDir());
    }

    public Path sessionsDir() {
        return runtimeRoot().resolve("sessions");
    }

    public Path sessionMappingPath(String sessionKey) {
        return sessionsDir().resolve(SessionKeys.safeFileId(sessionKey) + ".json");
    }

    public Path runDir(String runId) {
        return runtimeRoot().resolve("runs").resolve(runId);
    }

    public Path statePath(String runId) {
        return runDir(runId).resolve(STATE_FILE);
    }

    public Path eventsPath(String runId) {
        return runDir(runId).resolve(EVENTS_FILE);
    }

    public Path summaryPath(String runId) {
        return runDir(runId).resolve(SUMMARY_FILE);
    }

    public Path lastRunPath() {
        return runtimeRoot().resolve(LAST_RUN_FILE);
    }

    public Path hookTmpDir() {
        return resolve(properties.getHookTmpDir());
    }

    public Path sharedSessionKeyPath() {
        return hookTmpDir().resolve(SHARED_SESSION_KEY_FILE);
    }

    public Path routingSessionPath(String sessionKey) {
        return hookTmpDir().resolve("routing-sessions").resolve(SessionKeys.safeFileId(sessionKey) + ".json");
    }

    public Path guardsDir() {
        return hookTmpDir().resolve("run-observer-guards");
    }

    public Path contextDir() {
        return resolve(properties.getContextDir());
    }

    /** Tool-events mirror for a run, or null when the mirror is disabled. */
    public Path toolEventsPath(String runId) {
        RunObserverProperties.ToolEvents toolEvents = properties.getToolEvents();
        if (!toolEvents.isEnabled() || isBlank(toolEvents.getDir())) {
            return null;
        }
        return resolve(toolEvents.getDir()).resolve("run-" + runId + ".ndjson");
    }

    /** Agent task-completion artifacts for a session, or null when not configured. */
    public Path agentTaskArtifactsDir(String sessionKey) {
        String dir = properties.getArtifacts().getAgentTasksDir();
        return isBlank(dir) ? null : resolve(dir).resolve(SessionKeys.safeFileId(sessionKey));
    }

    /** Routing handoff artifact for a run, or null when not configured. */
    public Path routingHandoffArtifactPath(String runId) {
        String dir = properties.getArtifacts().getRoutingHandoffDir();
        return isBlank(dir) ? null : resolve(dir).resolve("run-" + runId + ".json");
    }

    public Path payloadsDir() {
        String dir = properties.getPayloads().getDir();
        return isBlank(dir) ? runtimeRoot().resolve("payloads") : resolve(dir);
    }

    public Path failureBundlesDir() {
        String dir = properties.getFailureBundles().getDir();
        return isBlank(dir) ? runtimeRoot().resolve("failure-bundles") : resolve(dir);
    }

    /**
     * Resolves a configured directory: absolute paths are kept, relative ones are anchored
     * at the project directory (or the working directory when none is configured).
     */
    public Path resolve(String configured) {
        Path path = Paths.get(configured == null ? "" : configured.trim());
        if (path.isAbsolute()) {
            return path.normalize();
        }
        String projectDir = properties.getProjectDir();
        Path base = isBlank(projectDir) ? Paths.get("").toAbsolutePath() : Paths.get(projectDir.trim());
        return base.resolve(path).toAbsolutePath().normalize();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
