package oktaauth.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import oktaauth.core.model.auth.AuthPluginData;
import oktaauth.core.model.auth.UserToken;
import oktaauth.core.model.session.SessionPayload;

@DisplayName("InMemorySessionStore")
class InMemorySessionStoreTest {

    private static final SessionPayload PAYLOAD = new SessionPayload(
            new UserToken("local-1"), new AuthPluginData("okta", Optional.empty(), Optional.empty()));

    private InMemorySessionStore store;

    @BeforeEach
    void setUp() {
        store = new InMemorySessionStore(Duration.ofHours(1), Duration.ofMinutes(5));
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    @Nested
    @DisplayName("establish")
    class Establish {

        @Test
        @DisplayName("should store a session with a unique URL-safe ID")
        void shouldStoreSession() {
            final var first = store.establish(PAYLOAD).await().indefinitely();
            final var second = store.establish(PAYLOAD).await().indefinitely();

            assertNotEquals(first.id(), second.id());
            assertEquals(43, first.id().length());
            assertTrue(first.id().matches("[A-Za-z0-9_-]+"));
            assertEquals(2, store.getSessionCount());
        }

        @Test
        @DisplayName("should expire after the configured TTL")
        void shouldApplyTtl() {
            final var session = store.establish(PAYLOAD).await().indefinitely();

            assertEquals(Duration.ofHours(1), Duration.between(session.createdAt(), session.expiresAt()));
        }
    }

    @Nested
    @DisplayName("destroy")
    class Destroy {

        @Test
        @DisplayName("should remove and return the session")
        void shouldRemoveSession() {
            final var session = store.establish(PAYLOAD).await().indefinitely();

            assertEquals(Optional.of(session), store.destroy(session.id()).await().indefinitely());
            assertEquals(0, store.getSessionCount());
        }

        @Test
        @DisplayName("should not return an expired session")
        void shouldNotReturnExpiredSession() {
            final var expiring = new InMemorySessionStore(Duration.ofMillis(-1), Duration.ofMinutes(5));
            try {
                final var session = expiring.establish(PAYLOAD).await().indefinitely();

                assertTrue(expiring.destroy(session.id()).await().indefinitely().isEmpty());
                assertEquals(0, expiring.getSessionCount());
            } finally {
                expiring.shutdown();
            }
        }

        @Test
        @DisplayName("should return empty for unknown IDs")
        void shouldReturnEmptyForUnknown() {
            assertTrue(store.destroy("unknown").await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should be safe to call twice")
        void shouldBeIdempotent() {
            final var session = store.establish(PAYLOAD).await().indefinitely();

            store.destroy(session.id()).await().indefinitely();

            assertTrue(store.destroy(session.id()).await().indefinitely().isEmpty());
            assertTrue(store.destroy(null).await().indefinitely().isEmpty());
        }
    }
}
