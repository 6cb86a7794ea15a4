package oktaauth.core.model.auth;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome of a verified authorization code exchange.
 *
 * @param tokenSet Tokens issued by the provider
 * @param claims Verified ID token claims, merged with userinfo claims; null-valued claims are dropped
 */
public record TokenExchangeResult(TokenSet tokenSet, Map<String, Object> claims) {

    public TokenExchangeResult {
        if (tokenSet == null) {
            throw new IllegalArgumentException("Token set is required");
        }
        claims = claims == null
                ? Map.of()
                : claims.entrySet().stream()
                        .filter(entry -> entry.getKey() != null && entry.getValue() != null)
                        .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }
}
