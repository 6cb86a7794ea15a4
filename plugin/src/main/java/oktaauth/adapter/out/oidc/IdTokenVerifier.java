package oktaauth.adapter.out.oidc;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.jwx.JsonWebStructure;
import org.jose4j.lang.JoseException;

import oktaauth.core.model.auth.TokenExchangeException;

/**
 * Verifies ID tokens against the provider's signing keys.
 *
 * <p>Checks signature, issuer, audience (the client ID) and expiry with the
 * configured clock skew. An unknown key ID triggers one key set refresh to
 * follow provider key rotation.
 */
final class IdTokenVerifier {

    private static final Logger LOG = Logger.getLogger(IdTokenVerifier.class);
    private static final AlgorithmConstraints ASYMMETRIC_ONLY = new AlgorithmConstraints(
            AlgorithmConstraints.ConstraintType.PERMIT,
            AlgorithmIdentifiers.RSA_USING_SHA256,
            AlgorithmIdentifiers.RSA_USING_SHA384,
            AlgorithmIdentifiers.RSA_USING_SHA512,
            AlgorithmIdentifiers.ECDSA_USING_P256_CURVE_AND_SHA256,
            AlgorithmIdentifiers.ECDSA_USING_P384_CURVE_AND_SHA384,
            AlgorithmIdentifiers.ECDSA_USING_P521_CURVE_AND_SHA512);

    private final JwksClient jwksClient;
    private final URI jwksUri;
    private final String issuer;
    private final String clientId;
    private final Duration clockSkew;
    private final AtomicReference<JsonWebKeySet> keySet;

    IdTokenVerifier(
            JwksClient jwksClient,
            URI jwksUri,
            JsonWebKeySet initialKeys,
            String issuer,
            String clientId,
            Duration clockSkew) {
        this.jwksClient = jwksClient;
        this.jwksUri = jwksUri;
        this.issuer = issuer;
        this.clientId = clientId;
        this.clockSkew = clockSkew;
        this.keySet = new AtomicReference<>(initialKeys);
    }

    /**
     * Verify an ID token.
     *
     * @param idToken Compact JWT
     * @return Uni with the verified claims, failing with {@link TokenExchangeException}
     */
    Uni<Map<String, Object>> verify(String idToken) {
        final String keyId;
        try {
            keyId = JsonWebStructure.fromCompactSerialization(idToken).getKeyIdHeaderValue();
        } catch (JoseException e) {
            return Uni.createFrom().failure(new TokenExchangeException("Malformed ID token", e));
        }

        final var known = JwksClient.findKey(keySet.get(), keyId);
        if (known.isPresent()) {
            return Uni.createFrom().item(() -> validateWithKey(idToken, known.get()));
        }

        LOG.infof("Signing key %s not found, refreshing JWKS", keyId);
        return jwksClient
                .fetch(jwksUri)
                .onFailure()
                .transform(e -> new TokenExchangeException("Failed to refresh identity provider keys", e))
                .map(refreshed -> {
                    keySet.set(refreshed);
                    final var key = JwksClient.findKey(refreshed, keyId)
                            .orElseThrow(() -> new TokenExchangeException("ID token signing key not found"));
                    return validateWithKey(idToken, key);
                });
    }

    private Map<String, Object> validateWithKey(String idToken, JsonWebKey key) {
        try {
            final var consumer = new JwtConsumerBuilder()
                    .setRequireSubject()
                    .setRequireExpirationTime()
                    .setAllowedClockSkewInSeconds((int) clockSkew.toSeconds())
                    .setExpectedIssuer(issuer)
                    .setExpectedAudience(clientId)
                    .setVerificationKey(key.getKey())
                    .setJwsAlgorithmConstraints(ASYMMETRIC_ONLY)
                    .build();
            return consumer.processToClaims(idToken).getClaimsMap();
        } catch (InvalidJwtException e) {
            LOG.debugv("ID token validation failed: {0}", e.getMessage());
            throw new TokenExchangeException(summarizeJwtError(e), e);
        }
    }

    private String summarizeJwtError(InvalidJwtException e) {
        if (e.hasExpired()) {
            return "ID token has expired";
        }
        if (e.hasErrorCode(ErrorCodes.ISSUER_INVALID)) {
            return "Invalid ID token issuer";
        }
        if (e.hasErrorCode(ErrorCodes.AUDIENCE_INVALID)) {
            return "Invalid ID token audience";
        }
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)) {
            return "Invalid ID token signature";
        }
        return "ID token validation failed";
    }
}
