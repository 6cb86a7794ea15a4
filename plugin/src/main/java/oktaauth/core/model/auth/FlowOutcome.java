package oktaauth.core.model.auth;

import java.util.Optional;

import oktaauth.core.model.session.Session;

/**
 * Result of an authentication flow step: where to send the browser and what
 * happened to the session on the way.
 *
 * @param location Redirect target
 * @param establishedSession Session created by this step
 * @param sessionCleared Whether the session cookie must be cleared
 */
public record FlowOutcome(String location, Optional<Session> establishedSession, boolean sessionCleared) {

    public FlowOutcome {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Redirect location is required");
        }
        if (establishedSession == null) {
            establishedSession = Optional.empty();
        }
    }

    public static FlowOutcome redirect(String location) {
        return new FlowOutcome(location, Optional.empty(), false);
    }

    public static FlowOutcome established(String location, Session session) {
        return new FlowOutcome(location, Optional.of(session), false);
    }

    public static FlowOutcome cleared(String location) {
        return new FlowOutcome(location, Optional.empty(), true);
    }
}
