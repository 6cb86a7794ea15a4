package oktaauth.core.model.auth;

/**
 * Query parameters the identity provider sends back to the return route.
 *
 * @param code Authorization code
 * @param state Opaque state sent with the authorization request
 * @param error OAuth2 error code, if the provider refused
 * @param errorDescription Human readable error description
 */
public record ProviderCallback(String code, String state, String error, String errorDescription) {

    public boolean hasError() {
        return error != null && !error.isBlank();
    }

    public boolean hasCode() {
        return code != null && !code.isBlank();
    }
}
