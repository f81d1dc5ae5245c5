package com.agentstudio.observability.session;

import com.agentstudio.observability.hook.HookEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Derives one stable session key per logical session.
 * <p>
 * Sources in priority order: ids in the invocation payload, ids in the environment, the
 * shared session key file, and finally the parent process id. Ids from the first two are
 * persisted to the shared file so siblings without direct access converge on the same key.
 *
 * @author Agent Studio 2025-2026
 */
public class SessionKeyResolver {

    private static final Logger log = LoggerFactory.getLogger(SessionKeyResolver.class);

    public enum Source {
        PAYLOAD,
        ENVIRONMENT,
        SHARED_FILE,
        PARENT_PID
    }

    /**
     * A resolved key and where it came from.
     */
    public record ResolvedSession(String key, Source source) {
    }

    private final SharedSessionKeyStore sharedStore;
    private final HookEnvironment environment;
    private final List<String> sessionEnvVariables;

    public SessionKeyResolver(SharedSessionKeyStore sharedStore, HookEnvironment environment,
                              List<String> sessionEnvVariables) {
        this.sharedStore = sharedStore;
        this.environment = environment;
        this.sessionEnvVariables = sessionEnvVariables;
    }

    /**
     * Resolves the session key. Never fails.
     *
     * @param payloadSessionId session id found in the payload, may be null
     */
    public ResolvedSession resolve(String payloadSessionId) {
        String fromPayload = SessionKeys.normalize(payloadSessionId);
        if (fromPayload != null) {
            sharedStore.persist(fromPayload, "payload");
            return resolved(fromPayload, Source.PAYLOAD);
        }

        Optional<String> fromEnv = environment.first(sessionEnvVariables).map(SessionKeys::normalize);
        if (fromEnv.isPresent()) {
            sharedStore.persist(fromEnv.get(), "env");
            return resolved(fromEnv.get(), Source.ENVIRONMENT);
        }

        Optional<String> shared = sharedStore.readAndRefresh().map(SessionKeys::normalize);
        if (shared.isPresent()) {
            return resolved(shared.get(), Source.SHARED_FILE);
        }

        return resolved("ppid-" + environment.parentPid(), Source.PARENT_PID);
    }

    private static ResolvedSession resolved(String key, Source source) {
        log.debug("Session key {} resolved from {}", key, source);
        return new ResolvedSession(key, source);
    }
}
