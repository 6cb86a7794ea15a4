package oktaauth.adapter.out.oidc;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.lang.JoseException;

/**
 * Fetches the provider's JSON Web Key Set.
 */
final class JwksClient {

    private static final Logger LOG = Logger.getLogger(JwksClient.class);

    private final WebClient webClient;
    private final Duration timeout;

    JwksClient(WebClient webClient, Duration timeout) {
        this.webClient = webClient;
        this.timeout = timeout;
    }

    Uni<JsonWebKeySet> fetch(URI jwksUri) {
        LOG.infov("Fetching JWKS from {0}", jwksUri);
        return webClient
                .getAbs(jwksUri.toString())
                .timeout(timeout.toMillis())
                .putHeader("Accept", "application/json")
                .send()
                .ifNoItem()
                .after(timeout)
                .failWith(() -> new JwksFetchException("Timeout fetching JWKS from " + jwksUri))
                .map(this::parseResponse)
                .invoke(keySet -> LOG.infov(
                        "Loaded {0} keys from {1}", keySet.getJsonWebKeys().size(), jwksUri));
    }

    private JsonWebKeySet parseResponse(HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            throw new JwksFetchException("JWKS endpoint returned status " + response.statusCode());
        }
        try {
            return new JsonWebKeySet(response.bodyAsString());
        } catch (JoseException e) {
            throw new JwksFetchException("Failed to parse JWKS response: " + e.getMessage(), e);
        }
    }

    static Optional<JsonWebKey> findKey(JsonWebKeySet keySet, String keyId) {
        if (keyId == null) {
            // without a key ID only an unambiguous single key is usable
            final var keys = keySet.getJsonWebKeys();
            if (keys.size() == 1) {
                return Optional.of(keys.get(0));
            }
            return Optional.empty();
        }
        return keySet.getJsonWebKeys().stream()
                .filter(key -> keyId.equals(key.getKeyId()))
                .findFirst();
    }

    /**
     * Exception thrown when the key set cannot be fetched or parsed.
     */
    static class JwksFetchException extends RuntimeException {

        JwksFetchException(String message) {
            super(message);
        }

        JwksFetchException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
