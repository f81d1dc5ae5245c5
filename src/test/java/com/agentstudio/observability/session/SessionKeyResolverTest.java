package com.agentstudio.observability.session;

import com.agentstudio.observability.MutableClock;
import com.agentstudio.observability.TestObserverProperties;
import com.agentstudio.observability.hook.HookEnvironment;
import com.agentstudio.observability.run.RunPaths;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.env.MockEnvironment;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for SessionKeyResolver and the shared session key file.
 */
class SessionKeyResolverTest {

    private static final List<String> SESSION_VARIABLES =
            List.of("CLAUDE_SESSION_ID", "CLAUDE_CONVERSATION_ID", "CLAUDE_CHAT_ID");

    @TempDir
    Path projectDir;

    private MutableClock clock;
    private MockEnvironment environment;
    private RunPaths paths;
    private SharedSessionKeyStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-06-01T10:00:00Z");
        environment = new MockEnvironment();
        paths = new RunPaths(TestObserverProperties.rootedAt(projectDir));
        store = new SharedSessionKeyStore(paths, new ObjectMapper(), Duration.ofHours(4), clock);
    }

    private SessionKeyResolver resolver() {
        return new SessionKeyResolver(store, new HookEnvironment(environment, 4242L), SESSION_VARIABLES);
    }

    @Nested
    @DisplayName("Priority order")
    class PriorityTests {

        @Test
        @DisplayName("Payload id wins over environment")
        void resolve_shouldPreferPayload() {
            environment.setProperty("CLAUDE_SESSION_ID", "from-env");

            SessionKeyResolver.ResolvedSession session = resolver().resolve("from-payload");

            assertThat(session.key()).isEqualTo("from-payload");
            assertThat(session.source()).isEqualTo(SessionKeyResolver.Source.PAYLOAD);
        }

        @Test
        @DisplayName("Environment variables are consulted in order")
        void resolve_shouldUseEnvironment() {
            environment.setProperty("CLAUDE_CHAT_ID", "chat");
            environment.setProperty("CLAUDE_CONVERSATION_ID", "conversation");

            SessionKeyResolver.ResolvedSession session = resolver().resolve(null);

            assertThat(session.key()).isEqualTo("conversation");
            assertThat(session.source()).isEqualTo(SessionKeyResolver.Source.ENVIRONMENT);
        }

        @Test
        @DisplayName("Sibling without an id converges on the shared key")
        void resolve_shouldFallBackToSharedFile() {
            resolver().resolve("3f2504e0-4f89-11d3-9a0c-0305e82c3301");

            SessionKeyResolver.ResolvedSession sibling = resolver().resolve(null);

            assertThat(sibling.key()).isEqualTo("shared-3f2504e0-4f89-11d3-9a0c-0305e82c3301");
            assertThat(sibling.source()).isEqualTo(SessionKeyResolver.Source.SHARED_FILE);
        }

        @Test
        @DisplayName("Parent process id is the last resort")
        void resolve_shouldFallBackToParentPid() {
            SessionKeyResolver.ResolvedSession session = resolver().resolve("  ");

            assertThat(session.key()).isEqualTo("ppid-4242");
            assertThat(session.source()).isEqualTo(SessionKeyResolver.Source.PARENT_PID);
        }
    }

    @Nested
    @DisplayName("Shared key expiry")
    class ExpiryTests {

        @Test
        @DisplayName("Reads refresh the expiry")
        void readAndRefresh_shouldSlideExpiry() {
            store.persist("s1", "env");
            clock.advance(Duration.ofHours(3));

            assertThat(store.readAndRefresh()).contains("s1");
            clock.advance(Duration.ofHours(3));

            assertThat(store.readAndRefresh()).contains("s1");
            SharedSessionKeyStore.SharedSessionKey key = store.read().orElseThrow();
            assertThat(key.createdAt()).isEqualTo("2025-06-01T10:00:00Z");
            assertThat(key.refreshedAt()).isEqualTo("2025-06-01T16:00:00Z");
            assertThat(key.expiresAt()).isEqualTo("2025-06-01T20:00:00Z");
        }

        @Test
        @DisplayName("Expired key is ignored")
        void readAndRefresh_shouldIgnoreExpiredKey() {
            store.persist("s1", "env");
            clock.advance(Duration.ofHours(5));

            assertThat(store.readAndRefresh()).isEmpty();
            assertThat(resolver().resolve(null).source()).isEqualTo(SessionKeyResolver.Source.PARENT_PID);
        }

        @Test
        @DisplayName("Persisting the same key keeps its creation metadata")
        void persist_shouldKeepCreationForSameKey() {
            store.persist("s1", "payload");
            clock.advance(Duration.ofMinutes(10));
            store.persist("s1", "env");

            SharedSessionKeyStore.SharedSessionKey key = store.read().orElseThrow();
            assertThat(key.createdBy()).isEqualTo("payload");
            assertThat(key.createdAt()).isEqualTo("2025-06-01T10:00:00Z");
            assertThat(key.refreshedAt()).isEqualTo("2025-06-01T10:10:00Z");
        }

        @Test
        @DisplayName("Malformed shared file is treated as absent")
        void readAndRefresh_shouldIgnoreMalformedFile() throws Exception {
            Files.createDirectories(paths.hookTmpDir());
            Files.writeString(paths.sharedSessionKeyPath(), "{not json");

            assertThat(store.readAndRefresh()).isEmpty();
        }
    }
}
