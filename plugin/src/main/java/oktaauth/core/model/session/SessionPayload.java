package oktaauth.core.model.session;

import oktaauth.core.model.auth.AuthPluginData;
import oktaauth.core.model.auth.UserToken;

/**
 * What an authenticated session carries: the local user and the provider
 * marker.
 */
public record SessionPayload(UserToken userToken, AuthPluginData authPlugin) {

    public SessionPayload {
        if (userToken == null) {
            throw new IllegalArgumentException("User token is required");
        }
        if (authPlugin == null) {
            throw new IllegalArgumentException("Auth plugin data is required");
        }
    }
}
