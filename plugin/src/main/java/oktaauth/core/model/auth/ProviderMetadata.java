package oktaauth.core.model.auth;

import java.net.URI;
import java.util.Optional;

/**
 * Endpoints advertised by the provider's OpenID configuration document.
 */
public record ProviderMetadata(
        String issuer,
        URI authorizationEndpoint,
        URI tokenEndpoint,
        Optional<URI> userinfoEndpoint,
        URI jwksUri,
        Optional<URI> endSessionEndpoint) {

    public ProviderMetadata {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("Issuer is required");
        }
        if (authorizationEndpoint == null) {
            throw new IllegalArgumentException("Authorization endpoint is required");
        }
        if (tokenEndpoint == null) {
            throw new IllegalArgumentException("Token endpoint is required");
        }
        if (jwksUri == null) {
            throw new IllegalArgumentException("JWKS URI is required");
        }
        if (userinfoEndpoint == null) {
            userinfoEndpoint = Optional.empty();
        }
        if (endSessionEndpoint == null) {
            endSessionEndpoint = Optional.empty();
        }
    }
}
