package oktaauth.core.model.auth;

import java.time.Instant;
import java.util.Optional;

/**
 * Tokens returned by the identity provider after a successful code exchange.
 *
 * <p>Stored with the session so that logout can send the ID token as
 * {@code id_token_hint}.
 *
 * @param accessToken The access token (always present on success)
 * @param idToken The raw ID token
 * @param refreshToken The refresh token, if granted
 * @param tokenType Token type, typically "Bearer"
 * @param expiresAt When the access token expires
 * @param scope Granted scopes
 */
public record TokenSet(
        String accessToken,
        Optional<String> idToken,
        Optional<String> refreshToken,
        String tokenType,
        Instant expiresAt,
        Optional<String> scope) {

    public TokenSet {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token is required");
        }
        if (tokenType == null || tokenType.isBlank()) {
            tokenType = "Bearer";
        }
        if (idToken == null) {
            idToken = Optional.empty();
        }
        if (refreshToken == null) {
            refreshToken = Optional.empty();
        }
        if (scope == null) {
            scope = Optional.empty();
        }
    }
}
