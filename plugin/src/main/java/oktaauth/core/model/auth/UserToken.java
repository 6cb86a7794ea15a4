package oktaauth.core.model.auth;

/**
 * Local user reference minted by the authorization API.
 *
 * @param id Local user ID
 */
public record UserToken(String id) {

    public UserToken {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("User ID is required");
        }
    }
}
