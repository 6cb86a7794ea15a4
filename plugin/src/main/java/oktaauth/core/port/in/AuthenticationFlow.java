package oktaauth.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import oktaauth.core.model.auth.FlowOutcome;
import oktaauth.core.model.auth.ProviderCallback;

/**
 * Use case interface for the browser login and logout flow.
 *
 * <p>Every step completes with a redirect; failures are reported through the
 * redirect target, never as an error response.
 */
public interface AuthenticationFlow {

    /**
     * Start a login.
     *
     * @param redirect Requested post-login destination, may be null
     * @return Uni with a redirect to the provider's authorization endpoint
     */
    Uni<FlowOutcome> initiate(String redirect);

    /**
     * Finish a login when the provider redirects back.
     *
     * @param callback Parameters sent by the provider
     * @return Uni with a redirect to the destination, carrying the new session
     */
    Uni<FlowOutcome> complete(ProviderCallback callback);

    /**
     * Destroy the local session and start a provider logout.
     *
     * @param sessionId Current session ID, if any
     * @param redirect Requested post-logout destination, may be null
     * @return Uni with a redirect to the provider end-session endpoint or the destination
     */
    Uni<FlowOutcome> logout(Optional<String> sessionId, String redirect);

    /**
     * Finish a logout when the provider redirects back.
     *
     * @param sessionId Current session ID, if any
     * @param redirect Final destination, may be null
     * @return Uni with a redirect to the destination
     */
    Uni<FlowOutcome> logoutReturn(Optional<String> sessionId, String redirect);
}
