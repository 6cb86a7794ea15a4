package oktaauth.core.model.auth;

/**
 * Thrown when the provider profile carries no email address.
 */
public class MissingEmailException extends AuthenticationFlowException {

    public static final String MESSAGE = "Cannot locate email address from the user profile.";

    public MissingEmailException() {
        super(MESSAGE);
    }
}
