package oktaauth.core.service.auth;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;

import oktaauth.core.config.OktaPluginConfig;
import oktaauth.core.util.SecureHash;

/**
 * Carries the post-login destination through the provider round-trip.
 *
 * <p>The OAuth2 {@code state} parameter is a compact HS256 JWS whose payload
 * is the destination URL. The key is derived from the client secret, so no
 * server-side record of pending logins is kept and a state altered in
 * transit fails verification.
 */
@ApplicationScoped
public class RedirectStateCodec {

    private static final Logger LOG = Logger.getLogger(RedirectStateCodec.class);
    private static final String KEY_CONTEXT = "okta-oidc-state:";
    private static final AlgorithmConstraints HS256_ONLY =
            new AlgorithmConstraints(AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA256);

    private final HmacKey key;

    @Inject
    public RedirectStateCodec(OktaPluginConfig config) {
        this(config.clientSecret().orElse(""));
    }

    public RedirectStateCodec(String clientSecret) {
        this.key = new HmacKey(SecureHash.sha256(KEY_CONTEXT + clientSecret));
    }

    /**
     * Sign a destination into a state value.
     *
     * @param destination Post-login destination
     * @return Compact JWS
     */
    public String encode(String destination) {
        final var jws = new JsonWebSignature();
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);
        jws.setPayload(destination);
        jws.setKey(key);
        try {
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new IllegalStateException("Failed to sign login state", e);
        }
    }

    /**
     * Verify a state value and recover the destination.
     *
     * @param state State returned by the provider, may be null
     * @return The destination, or empty if the state is missing or was not signed by this plugin
     */
    public Optional<String> decode(String state) {
        if (state == null || state.isBlank()) {
            return Optional.empty();
        }
        try {
            final var jws = new JsonWebSignature();
            jws.setAlgorithmConstraints(HS256_ONLY);
            jws.setCompactSerialization(state);
            jws.setKey(key);
            if (!jws.verifySignature()) {
                LOG.warn("Rejected login state with invalid signature");
                return Optional.empty();
            }
            return Optional.of(jws.getPayload());
        } catch (JoseException e) {
            LOG.warnf("Rejected malformed login state: %s", e.getMessage());
            return Optional.empty();
        }
    }
}
