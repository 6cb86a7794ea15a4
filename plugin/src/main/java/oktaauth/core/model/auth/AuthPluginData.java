package oktaauth.core.model.auth;

import java.util.Optional;

/**
 * Provider marker stored with a session.
 *
 * <p>A marker without a token set means the provider session has already
 * been ended.
 *
 * @param key Plugin key
 * @param tokenSet Provider tokens
 * @param logoutUrl Gateway path that ends the provider session, present
 *     only when the plugin requires explicit logout
 */
public record AuthPluginData(String key, Optional<TokenSet> tokenSet, Optional<String> logoutUrl) {

    public AuthPluginData {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Plugin key is required");
        }
        if (tokenSet == null) {
            tokenSet = Optional.empty();
        }
        if (logoutUrl == null) {
            logoutUrl = Optional.empty();
        }
    }
}
