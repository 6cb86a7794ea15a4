package oktaauth.core.model.auth;

/**
 * Thrown when the authorization code cannot be exchanged or the returned
 * tokens fail verification.
 */
public class TokenExchangeException extends AuthenticationFlowException {

    public TokenExchangeException(String message) {
        super(message);
    }

    public TokenExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
