package oktaauth.core.model.auth;

/**
 * Base class for per-request authentication failures.
 *
 * <p>The message is safe to show to the user; it ends up in the
 * {@code errorMessage} query parameter of the failure redirect. Internal
 * details belong in the cause.
 */
public class AuthenticationFlowException extends RuntimeException {

    public AuthenticationFlowException(String message) {
        super(message);
    }

    public AuthenticationFlowException(String message, Throwable cause) {
        super(message, cause);
    }
}
