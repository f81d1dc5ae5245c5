package com.agentstudio.observability.hook;

import org.springframework.core.env.Environment;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the hook process environment: host-provided variables and the parent
 * process id. Backed by the Spring {@link Environment} so tests can supply variables.
 *
 * @author Agent Studio 2025-2026
 */
public class HookEnvironment {

    public static final String TRACEPARENT = "CLAUDE_TRACEPARENT";
    public static final String W3C_TRACEPARENT = "TRACEPARENT";
    public static final String WORKFLOW_ID = "CLAUDE_WORKFLOW_ID";
    public static final String WORKFLOW_STEP = "CLAUDE_WORKFLOW_STEP";
    public static final String RECURSION_FLAG = "CLAUDE_RUN_OBSERVER_ACTIVE";

    private final Environment environment;
    private final long parentPid;

    public HookEnvironment(Environment environment) {
        this(environment, ProcessHandle.current().parent().map(ProcessHandle::pid).orElse(-1L));
    }

    public HookEnvironment(Environment environment, long parentPid) {
        this.environment = environment;
        this.parentPid = parentPid;
    }

    /**
     * Returns the trimmed value of a variable, empty when unset or blank.
     */
    public Optional<String> get(String name) {
        String value = environment.getProperty(name);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    /**
     * Returns the first set variable among {@code names}.
     */
    public Optional<String> first(List<String> names) {
        if (names == null) {
            return Optional.empty();
        }
        for (String name : names) {
            Optional<String> value = get(name);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /** Inbound W3C traceparent, if the host propagates one. */
    public Optional<String> traceparent() {
        return get(TRACEPARENT).or(() -> get(W3C_TRACEPARENT));
    }

    /** Parent process id, or -1 when unknown. */
    public long parentPid() {
        return parentPid;
    }
}
