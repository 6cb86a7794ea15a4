package oktaauth.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import oktaauth.core.model.session.Session;
import oktaauth.core.model.session.SessionPayload;

/**
 * Port for server-side session storage.
 */
public interface SessionStore {

    /**
     * Create a session holding the payload.
     *
     * @param payload User and provider data
     * @return Uni with the stored session
     */
    Uni<Session> establish(SessionPayload payload);

    /**
     * Remove a session. Safe to call for unknown IDs.
     *
     * @param sessionId Session ID
     * @return Uni with the removed session, or empty if there was none or it had expired
     */
    Uni<Optional<Session>> destroy(String sessionId);
}
