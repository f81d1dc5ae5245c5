package com.agentstudio.observability;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the Agent Studio run observer.
 * Every value can be overridden from the hook environment (see {@code application.properties}).
 *
 * @author Agent Studio 2025-2026
 */
@ConfigurationProperties(prefix = "agent-studio.observability")
public class RunObserverProperties {

    /**
     * Default constructor.
     */
    public RunObserverProperties() {
    }

    /** Enable/disable the run observer. Disabled hooks only emit the default response. */
    private boolean enabled = true;

    /** Raise project log level to DEBUG (logs go to stderr). */
    private boolean debug = false;

    /** Project root. Relative directories resolve against it; blank means the working directory. */
    private String projectDir = "";

    /** Runtime root holding sessions/, runs/ and last-run.json. */
    private String runtimeDir = ".claude/context/runtime";

    /** Shared scratch directory (shared session key, routing sessions, recursion guards). */
    private String hookTmpDir = ".claude/context/tmp";

    /** Internal context directory; file tools touching it produce artifact spans. */
    private String contextDir = ".claude/context";

    /** Agent name used when no invocation names one and no agent is known yet. */
    private String defaultAgent = "main";

    /** Environment variables consulted for a session id, in priority order. */
    private List<String> sessionEnvVariables = new ArrayList<>(List.of(
            "CLAUDE_SESSION_ID", "CLAUDE_CONVERSATION_ID", "CLAUDE_CHAT_ID"));

    /** Environment variables consulted for the calling agent name, in priority order. */
    private List<String> agentEnvVariables = new ArrayList<>(List.of("CLAUDE_AGENT_NAME", "CLAUDE_AGENT_ROLE"));

    private final Session session = new Session();
    private final Delegation delegation = new Delegation();
    private final Metrics metrics = new Metrics();
    private final Events events = new Events();
    private final Trace trace = new Trace();
    private final Input input = new Input();
    private final State state = new State();
    private final ToolEvents toolEvents = new ToolEvents();
    private final Artifacts artifacts = new Artifacts();
    private final Payloads payloads = new Payloads();
    private final FailureBundles failureBundles = new FailureBundles();

    // Getters and Setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    public String getProjectDir() {
        return projectDir;
    }

    public void setProjectDir(String projectDir) {
        this.projectDir = projectDir;
    }

    public String getRuntimeDir() {
        return runtimeDir;
    }

    public void setRuntimeDir(String runtimeDir) {
        this.runtimeDir = runtimeDir;
    }

    public String getHookTmpDir() {
        return hookTmpDir;
    }

    public void setHookTmpDir(String hookTmpDir) {
        this.hookTmpDir = hookTmpDir;
    }

    public String getContextDir() {
        return contextDir;
    }

    public void setContextDir(String contextDir) {
        this.contextDir = contextDir;
    }

    public String getDefaultAgent() {
        return defaultAgent;
    }

    public void setDefaultAgent(String defaultAgent) {
        this.defaultAgent = defaultAgent;
    }

    public List<String> getSessionEnvVariables() {
        return sessionEnvVariables;
    }

    public void setSessionEnvVariables(List<String> sessionEnvVariables) {
        this.sessionEnvVariables = sessionEnvVariables;
    }

    public List<String> getAgentEnvVariables() {
        return agentEnvVariables;
    }

    public void setAgentEnvVariables(List<String> agentEnvVariables) {
        this.agentEnvVariables = agentEnvVariables;
    }

    public Session getSession() {
        return session;
    }

    public Delegation getDelegation() {
        return delegation;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public Events getEvents() {
        return events;
    }

    public Trace getTrace() {
        return trace;
    }

    public Input getInput() {
        return input;
    }

    public State getState() {
        return state;
    }

    public ToolEvents getToolEvents() {
        return toolEvents;
    }

    public Artifacts getArtifacts() {
        return artifacts;
    }

    public Payloads getPayloads() {
        return payloads;
    }

    public FailureBundles getFailureBundles() {
        return failureBundles;
    }

    /** Shared session key settings. */
    public static class Session {

        /** Sliding expiry of the shared session key file; each read extends it. */
        private Duration sharedKeyTtl = Duration.ofHours(4);

        public Duration getSharedKeyTtl() {
            return sharedKeyTtl;
        }

        public void setSharedKeyTtl(Duration sharedKeyTtl) {
            this.sharedKeyTtl = sharedKeyTtl;
        }
    }

    /** Pending delegation queue settings. */
    public static class Delegation {

        /** Entries older than this are never consumed. */
        private Duration ttl = Duration.ofMinutes(3);

        /** Maximum queued delegations; oldest dropped on overflow. */
        private int maxPending = 20;

        /** Maximum depth of the subagent parent stack. */
        private int maxParentStack = 20;

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public int getMaxPending() {
            return maxPending;
        }

        public void setMaxPending(int maxPending) {
            this.maxPending = maxPending;
        }

        public int getMaxParentStack() {
            return maxParentStack;
        }

        public void setMaxParentStack(int maxParentStack) {
            this.maxParentStack = maxParentStack;
        }
    }

    /** Metrics rollup settings. */
    public static class Metrics {

        /** Maximum entries kept per metrics map (top-N by total_ms). */
        private int maxEntries = 50;

        /** Maximum queued start timestamps per (agent, tool) key. */
        private int maxInFlightPerKey = 20;

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }

        public int getMaxInFlightPerKey() {
            return maxInFlightPerKey;
        }

        public void setMaxInFlightPerKey(int maxInFlightPerKey) {
            this.maxInFlightPerKey = maxInFlightPerKey;
        }
    }

    /** Event log settings. */
    public static class Events {

        /** Rotate events.ndjson once it exceeds this many bytes. */
        private long rotateBytes = 5L * 1024 * 1024;

        /** Check the rotation threshold on every Nth append. */
        private int rotateEvery = 25;

        /** Maximum errors retained in the run document. */
        private int maxErrors = 20;

        public long getRotateBytes() {
            return rotateBytes;
        }

        public void setRotateBytes(long rotateBytes) {
            this.rotateBytes = rotateBytes;
        }

        public int getRotateEvery() {
            return rotateEvery;
        }

        public void setRotateEvery(int rotateEvery) {
            this.rotateEvery = rotateEvery;
        }

        public int getMaxErrors() {
            return maxErrors;
        }

        public void setMaxErrors(int maxErrors) {
            this.maxErrors = maxErrors;
        }
    }

    /** Trace settings. */
    public static class Trace {

        /** Fraction of runs whose root trace is marked sampled. */
        private double sampleRatio = 1.0;

        public double getSampleRatio() {
            return sampleRatio;
        }

        public void setSampleRatio(double sampleRatio) {
            this.sampleRatio = sampleRatio;
        }
    }

    /** Stdin reading limits. */
    public static class Input {

        /** Stop reading when no new bytes arrive for this long (after the first byte). */
        private Duration idleTimeout = Duration.ofMillis(150);

        /** Hard cap on the time spent reading stdin. */
        private Duration totalTimeout = Duration.ofMillis(1000);

        /** Maximum payload bytes read. */
        private int maxBytes = 512 * 1024;

        public Duration getIdleTimeout() {
            return idleTimeout;
        }

        public void setIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
        }

        public Duration getTotalTimeout() {
            return totalTimeout;
        }

        public void setTotalTimeout(Duration totalTimeout) {
            this.totalTimeout = totalTimeout;
        }

        public int getMaxBytes() {
            return maxBytes;
        }

        public void setMaxBytes(int maxBytes) {
            this.maxBytes = maxBytes;
        }
    }

    /** Run state persistence settings. */
    public static class State {

        /** Re-apply attempts when another writer committed between read and write. */
        private int maxWriteRetries = 2;

        public int getMaxWriteRetries() {
            return maxWriteRetries;
        }

        public void setMaxWriteRetries(int maxWriteRetries) {
            this.maxWriteRetries = maxWriteRetries;
        }
    }

    /** Tool-events mirror stream for the external audit subsystem. */
    public static class ToolEvents {

        private boolean enabled = true;

        private String dir = ".claude/context/artifacts/tool-events";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }

    /** Artifact side channels. Blank directories disable the channel. */
    public static class Artifacts {

        /** Agent task-completion artifacts, one folder per session. */
        private String agentTasksDir = "";

        /** Routing handoff outcome artifacts. */
        private String routingHandoffDir = ".claude/context/artifacts/routing-handoff";

        public String getAgentTasksDir() {
            return agentTasksDir;
        }

        public void setAgentTasksDir(String agentTasksDir) {
            this.agentTasksDir = agentTasksDir;
        }

        public String getRoutingHandoffDir() {
            return routingHandoffDir;
        }

        public void setRoutingHandoffDir(String routingHandoffDir) {
            this.routingHandoffDir = routingHandoffDir;
        }
    }

    /** Sanitized tool payload storage (disabled by default). */
    public static class Payloads {

        private boolean enabled = false;

        /** Blank means {@code <runtime>/payloads}. */
        private String dir = "";

        /** Serialized inputs/outputs above this size are truncated. */
        private int maxBytes = 32 * 1024;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }

        public int getMaxBytes() {
            return maxBytes;
        }

        public void setMaxBytes(int maxBytes) {
            this.maxBytes = maxBytes;
        }
    }

    /** Failure bundle generation (disabled by default). */
    public static class FailureBundles {

        private boolean enabled = false;

        /** Blank means {@code <runtime>/failure-bundles}. */
        private String dir = "";

        private int tailLines = 50;

        private int tailBytes = 64 * 1024;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }

        public int getTailLines() {
            return tailLines;
        }

        public void setTailLines(int tailLines) {
            this.tailLines = tailLines;
        }

        public int getTailBytes() {
            return tailBytes;
        }

        public void setTailBytes(int tailBytes) {
            this.tailBytes = tailBytes;
        }
    }
}
