package turnstile.adapter.in.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import turnstile.adapter.out.store.memory.InMemoryKeyValueStore;
import turnstile.core.model.session.SessionEvent;
import turnstile.core.model.session.UserSession;
import turnstile.core.service.session.SessionService;
import turnstile.core.service.store.KeyValueStoreRegistry;
import turnstile.support.RecordingMetrics;
import turnstile.support.TestConfigs;
import turnstile.support.TestStores;

@DisplayName("SessionEventAuditor")
class SessionEventAuditorTest {

    private static final String CHANNEL = "turnstile:session-events";

    private InMemoryKeyValueStore store;
    private KeyValueStoreRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        registry = TestStores.registryFor(store);
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    private void publish(String message) {
        store.publish(CHANNEL, message).await().indefinitely();
    }

    @Test
    @DisplayName("should count events published on the channel")
    void shouldCountEvents() {
        var auditor = new SessionEventAuditor(registry, new TestConfigs.TestSessionConfig());
        auditor.onStart(null);

        publish("{\"type\":\"created\",\"sessionId\":\"s1\",\"userId\":\"u1\",\"timestamp\":1}");
        publish("{\"type\":\"evicted\",\"sessionId\":\"s0\",\"userId\":\"u1\",\"timestamp\":2}");

        assertTrue(auditor.isSubscribed());
        assertEquals(1, auditor.count(SessionEvent.Type.CREATED));
        assertEquals(1, auditor.count(SessionEvent.Type.EVICTED));
        assertEquals(0, auditor.count(SessionEvent.Type.DESTROYED));
    }

    @Test
    @DisplayName("should see events emitted by the session service")
    void shouldSeeSessionServiceEvents() {
        var sessionConfig = new TestConfigs.TestSessionConfig();
        var auditor = new SessionEventAuditor(registry, sessionConfig);
        auditor.onStart(null);
        var sessions = new SessionService(
                registry, sessionConfig, new TestConfigs.TestStoreConfig(), new RecordingMetrics());
        var now = System.currentTimeMillis();
        var session = new UserSession("u1", "trader", null, "user", Set.of(), now, now, null, null, null);

        sessions.createSession("s1", session).await().indefinitely();
        sessions.destroySession("s1").await().indefinitely();

        assertEquals(1, auditor.count(SessionEvent.Type.CREATED));
        assertEquals(1, auditor.count(SessionEvent.Type.DESTROYED));
    }

    @Test
    @DisplayName("should ignore unreadable messages")
    void shouldIgnoreGarbage() {
        var auditor = new SessionEventAuditor(registry, new TestConfigs.TestSessionConfig());
        auditor.onStart(null);

        publish("not json");
        publish("{\"sessionId\":\"s1\"}");

        assertEquals(0, auditor.count(SessionEvent.Type.CREATED));
    }

    @Test
    @DisplayName("should stop counting after cleanup")
    void shouldUnsubscribeOnCleanup() {
        var auditor = new SessionEventAuditor(registry, new TestConfigs.TestSessionConfig());
        auditor.onStart(null);

        auditor.cleanup();
        publish("{\"type\":\"created\",\"sessionId\":\"s1\",\"userId\":\"u1\",\"timestamp\":1}");

        assertFalse(auditor.isSubscribed());
        assertEquals(0, auditor.count(SessionEvent.Type.CREATED));
    }

    @Test
    @DisplayName("should not subscribe when events are disabled")
    void shouldStayIdleWhenDisabled() {
        var auditor = new SessionEventAuditor(registry, new TestConfigs.TestSessionConfig().eventsEnabled(false));

        auditor.onStart(null);

        assertFalse(auditor.isSubscribed());
    }
}
