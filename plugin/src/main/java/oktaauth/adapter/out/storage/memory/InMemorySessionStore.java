package oktaauth.adapter.out.storage.memory;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import oktaauth.core.config.OktaPluginConfig;
import oktaauth.core.model.session.Session;
import oktaauth.core.model.session.SessionPayload;
import oktaauth.core.port.out.SessionStore;

/**
 * In-memory session store.
 *
 * <p>Sessions are lost on restart and not shared across instances; run a
 * single instance or use sticky sessions.
 */
@ApplicationScoped
public class InMemorySessionStore implements SessionStore {

    private static final Logger LOG = Logger.getLogger(InMemorySessionStore.class);
    private static final int SESSION_ID_BYTES = 32; // 256 bits
    private static final int MAX_ID_ATTEMPTS = 3;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final ScheduledExecutorService cleanupExecutor;

    @Inject
    public InMemorySessionStore(OktaPluginConfig config) {
        this(config.session().ttl(), config.session().cleanupInterval());
    }

    public InMemorySessionStore(Duration ttl, Duration cleanupInterval) {
        this.ttl = ttl;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-cleanup");
            t.setDaemon(true);
            return t;
        });
        final var interval = Math.max(1, cleanupInterval.toMillis());
        cleanupExecutor.scheduleAtFixedRate(
                this::cleanupExpiredSessions, interval, interval, TimeUnit.MILLISECONDS);
    }

    @Override
    public Uni<Session> establish(SessionPayload payload) {
        return Uni.createFrom().item(() -> {
            final var now = Instant.now();
            for (int attempt = 1; attempt <= MAX_ID_ATTEMPTS; attempt++) {
                final var session = new Session(generateId(), payload, now, now.plus(ttl));
                if (sessions.putIfAbsent(session.id(), session) == null) {
                    LOG.debugf("Session created for user %s", payload.userToken().id());
                    return session;
                }
                LOG.warnf("Session ID collision detected, attempt %d", attempt);
            }
            throw new IllegalStateException("Failed to generate unique session ID after " + MAX_ID_ATTEMPTS + " attempts");
        });
    }

    @Override
    public Uni<Optional<Session>> destroy(String sessionId) {
        return Uni.createFrom().item(() -> {
            if (sessionId == null) {
                return Optional.<Session>empty();
            }
            final var removed = Optional.ofNullable(sessions.remove(sessionId));
            if (removed.isPresent()) {
                LOG.debug("Session destroyed");
            }
            return removed.filter(session -> !session.isExpired());
        });
    }

    private void cleanupExpiredSessions() {
        int removed = 0;
        for (var entry : sessions.entrySet()) {
            if (entry.getValue().isExpired() && sessions.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired sessions", removed);
        }
    }

    private static String generateId() {
        byte[] bytes = new byte[SESSION_ID_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }

    /**
     * Shuts down the cleanup executor.
     */
    @PreDestroy
    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Return the current session count (for testing).
     */
    int getSessionCount() {
        return sessions.size();
    }
}
