package oktaauth.core.model.auth;

/**
 * Thrown when the local user for a provider identity cannot be found or
 * created.
 */
public class IdentityResolutionException extends AuthenticationFlowException {

    public IdentityResolutionException(String message) {
        super(message);
    }

    public IdentityResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
