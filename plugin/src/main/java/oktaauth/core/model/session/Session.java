package oktaauth.core.model.session;

import java.time.Instant;

/**
 * Server-side record of an authenticated browser session.
 *
 * @param id Unique session identifier (cryptographically secure)
 * @param payload User and provider data
 * @param createdAt Session creation timestamp
 * @param expiresAt Session expiration timestamp
 */
public record Session(String id, SessionPayload payload, Instant createdAt, Instant expiresAt) {

    public boolean isExpired() {
        return Instant.now().isAfter(expiresAt);
    }
}
