package oktaauth.adapter.out.authapi;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;

import oktaauth.core.config.OktaPluginConfig;
import oktaauth.core.model.auth.IdentityResolutionException;
import oktaauth.core.model.auth.UserProfile;
import oktaauth.core.model.auth.UserToken;
import oktaauth.core.port.out.UserTokenResolver;

/**
 * Resolves provider identities to local users through the authorization API.
 *
 * <p>Looks the user up by (source, subject) and creates it on 404. Requests
 * are authenticated with an {@code X-Magda-Session} header: an HS256 JWT
 * carrying the acting {@code userId}, signed with the shared JWT secret.
 */
@ApplicationScoped
public class AuthorizationApiUserTokenResolver implements UserTokenResolver {

    private static final Logger LOG = Logger.getLogger(AuthorizationApiUserTokenResolver.class);
    static final String SESSION_HEADER = "X-Magda-Session";

    private final WebClient webClient;
    private final OktaPluginConfig config;

    @Inject
    public AuthorizationApiUserTokenResolver(WebClient webClient, OktaPluginConfig config) {
        this.webClient = webClient;
        this.config = config;
    }

    @Override
    public Uni<UserToken> resolveOrCreateUser(UserProfile profile, String source) {
        return Uni.createFrom()
                .deferred(() -> lookupUser(source, profile.id()))
                .flatMap(existing -> existing.map(token -> Uni.createFrom().item(token))
                        .orElseGet(() -> createUser(profile, source)))
                .ifNoItem()
                .after(config.timeout())
                .failWith(() -> new IdentityResolutionException("Timed out resolving local user"))
                .onFailure(error -> !(error instanceof IdentityResolutionException))
                .transform(error -> new IdentityResolutionException("Failed to resolve local user", error));
    }

    private Uni<Optional<UserToken>> lookupUser(String source, String sourceId) {
        final var url = baseUrl() + "/private/users/lookup?source=" + urlEncode(source) + "&sourceId="
                + urlEncode(sourceId);
        return webClient
                .getAbs(url)
                .timeout(config.timeout().toMillis())
                .putHeader("Accept", "application/json")
                .putHeader(SESSION_HEADER, sessionToken())
                .send()
                .map(response -> {
                    if (response.statusCode() == 404) {
                        LOG.debugf("No local user for source=%s, creating one", source);
                        return Optional.<UserToken>empty();
                    }
                    return Optional.of(parseUser(response, "lookup"));
                });
    }

    private Uni<UserToken> createUser(UserProfile profile, String source) {
        final var body = new JsonObject()
                .put("displayName", profile.displayNameOrEmail())
                .put("email", profile.email())
                .put("source", source)
                .put("sourceId", profile.id());
        return webClient
                .postAbs(baseUrl() + "/private/users")
                .timeout(config.timeout().toMillis())
                .putHeader("Accept", "application/json")
                .putHeader(SESSION_HEADER, sessionToken())
                .sendJsonObject(body)
                .map(response -> {
                    final var user = parseUser(response, "create");
                    LOG.infof("Created local user %s for source=%s", user.id(), source);
                    return user;
                });
    }

    private UserToken parseUser(HttpResponse<Buffer> response, String operation) {
        if (response.statusCode() != 200 && response.statusCode() != 201) {
            LOG.warnf("Authorization API user %s failed with status %d", operation, response.statusCode());
            throw new IdentityResolutionException("Authorization API returned status " + response.statusCode());
        }
        final var json = response.bodyAsJsonObject();
        final var id = json == null ? null : json.getString("id");
        if (id == null || id.isBlank()) {
            throw new IdentityResolutionException("Authorization API response missing user id");
        }
        return new UserToken(id);
    }

    String sessionToken() {
        final var secret = config.authorizationApi()
                .jwtSecret()
                .orElseThrow(() -> new IdentityResolutionException("Authorization API JWT secret is not configured"));
        final var claims = new JwtClaims();
        claims.setClaim("userId", config.authorizationApi().userId());
        claims.setIssuedAtToNow();

        final var jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);
        jws.setKey(new HmacKey(secret.getBytes(StandardCharsets.UTF_8)));
        // shared secrets are often shorter than 256 bits
        jws.setDoKeyValidation(false);
        try {
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new IdentityResolutionException("Failed to sign authorization API session", e);
        }
    }

    private String baseUrl() {
        final var base = config.authorizationApi().baseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
