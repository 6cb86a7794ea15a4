package oktaauth.support;

import java.time.Instant;
import java.util.Map;

import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jwk.RsaJsonWebKey;
import org.jose4j.jwk.RsaJwkGenerator;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.NumericDate;
import org.jose4j.lang.JoseException;

/**
 * RSA keys and signed ID tokens for tests.
 */
public final class TestTokens {

    private TestTokens() {}

    public static RsaJsonWebKey generateKey(String keyId) {
        try {
            final var key = RsaJwkGenerator.generateJwk(2048);
            key.setKeyId(keyId);
            return key;
        } catch (JoseException e) {
            throw new IllegalStateException(e);
        }
    }

    public static String jwks(RsaJsonWebKey... keys) {
        return new JsonWebKeySet(keys).toJson();
    }

    public static String idToken(
            RsaJsonWebKey key, String issuer, String audience, Map<String, Object> claims, Instant expiresAt) {
        final var jwtClaims = new JwtClaims();
        jwtClaims.setIssuer(issuer);
        jwtClaims.setAudience(audience);
        jwtClaims.setExpirationTime(NumericDate.fromSeconds(expiresAt.getEpochSecond()));
        jwtClaims.setIssuedAt(NumericDate.fromSeconds(expiresAt.getEpochSecond() - 3600));
        claims.forEach(jwtClaims::setClaim);

        final var jws = new JsonWebSignature();
        jws.setPayload(jwtClaims.toJson());
        jws.setKey(key.getPrivateKey());
        jws.setKeyIdHeaderValue(key.getKeyId());
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.RSA_USING_SHA256);
        try {
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new IllegalStateException(e);
        }
    }
}
