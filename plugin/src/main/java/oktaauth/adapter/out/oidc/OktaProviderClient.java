package oktaauth.adapter.out.oidc;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import oktaauth.core.model.auth.ProviderMetadata;
import oktaauth.core.model.auth.TokenExchangeException;
import oktaauth.core.model.auth.TokenExchangeResult;
import oktaauth.core.model.auth.TokenSet;
import oktaauth.core.port.out.ProviderClient;
import oktaauth.core.util.RedirectUrls;

/**
 * Authorization code flow client for one discovered Okta authorization server.
 *
 * <p>Authenticates to the token endpoint with {@code client_secret_basic}.
 */
final class OktaProviderClient implements ProviderClient {

    private static final Logger LOG = Logger.getLogger(OktaProviderClient.class);
    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600L;

    private final WebClient webClient;
    private final ProviderMetadata metadata;
    private final IdTokenVerifier idTokenVerifier;
    private final String clientId;
    private final String clientSecret;
    private final String redirectUri;
    private final Duration timeout;

    OktaProviderClient(
            WebClient webClient,
            ProviderMetadata metadata,
            IdTokenVerifier idTokenVerifier,
            String clientId,
            String clientSecret,
            String redirectUri,
            Duration timeout) {
        this.webClient = webClient;
        this.metadata = metadata;
        this.idTokenVerifier = idTokenVerifier;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.redirectUri = redirectUri;
        this.timeout = timeout;
    }

    @Override
    public ProviderMetadata metadata() {
        return metadata;
    }

    @Override
    public String redirectUri() {
        return redirectUri;
    }

    @Override
    public URI authorizationUrl(String scope, String state) {
        final var params = new LinkedHashMap<String, String>();
        params.put("response_type", "code");
        params.put("client_id", clientId);
        params.put("redirect_uri", redirectUri);
        params.put("scope", scope);
        params.put("state", state);
        return URI.create(RedirectUrls.withQuery(metadata.authorizationEndpoint().toString(), params));
    }

    @Override
    public Uni<TokenExchangeResult> exchangeCode(String code) {
        LOG.debugf("Exchanging authorization code with IdP: %s", metadata.tokenEndpoint());

        final var credentials = urlEncode(clientId) + ":" + urlEncode(clientSecret);
        final var encoded = Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));

        return webClient
                .postAbs(metadata.tokenEndpoint().toString())
                .timeout(timeout.toMillis())
                .putHeader("Content-Type", "application/x-www-form-urlencoded")
                .putHeader("Accept", "application/json")
                .putHeader("Authorization", "Basic " + encoded)
                .sendBuffer(Buffer.buffer(buildFormBody(code)))
                .ifNoItem()
                .after(timeout)
                .failWith(() -> new TokenExchangeException("Timed out exchanging authorization code"))
                .map(this::parseTokenResponse)
                .flatMap(this::verify)
                .onFailure(error -> !(error instanceof TokenExchangeException))
                .transform(error -> new TokenExchangeException("Token exchange with identity provider failed", error));
    }

    @Override
    public Optional<URI> endSessionUrl(TokenSet tokenSet, String postLogoutRedirect) {
        if (metadata.endSessionEndpoint().isEmpty()) {
            return Optional.empty();
        }
        final var params = new LinkedHashMap<String, String>();
        if (tokenSet.idToken().isPresent()) {
            params.put("id_token_hint", tokenSet.idToken().get());
        } else {
            params.put("client_id", clientId);
        }
        params.put("post_logout_redirect_uri", postLogoutRedirect);
        return Optional.of(URI.create(
                RedirectUrls.withQuery(metadata.endSessionEndpoint().get().toString(), params)));
    }

    private String buildFormBody(String code) {
        final var params = new LinkedHashMap<String, String>();
        params.put("grant_type", "authorization_code");
        params.put("code", code);
        params.put("redirect_uri", redirectUri);

        return params.entrySet().stream()
                .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
                .reduce((a, b) -> a + "&" + b)
                .orElse("");
    }

    private TokenSet parseTokenResponse(HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            LOG.warnf("Token exchange failed with status %d: %s", response.statusCode(), response.bodyAsString());
            throw new TokenExchangeException("Identity provider rejected the authorization code");
        }

        final var json = response.bodyAsJsonObject();
        final var accessToken = json.getString("access_token");
        if (accessToken == null || accessToken.isBlank()) {
            throw new TokenExchangeException("Identity provider response missing access_token");
        }
        final var idToken = json.getString("id_token");
        if (idToken == null || idToken.isBlank()) {
            throw new TokenExchangeException("Identity provider response missing id_token");
        }

        final var expiresIn = json.getLong("expires_in", DEFAULT_EXPIRES_IN_SECONDS);
        return new TokenSet(
                accessToken,
                Optional.of(idToken),
                Optional.ofNullable(json.getString("refresh_token")),
                json.getString("token_type", "Bearer"),
                Instant.now().plusSeconds(expiresIn),
                Optional.ofNullable(json.getString("scope")));
    }

    private Uni<TokenExchangeResult> verify(TokenSet tokenSet) {
        return idTokenVerifier
                .verify(tokenSet.idToken().orElseThrow())
                .flatMap(claims -> fetchUserinfo(tokenSet, claims))
                .map(claims -> new TokenExchangeResult(tokenSet, claims));
    }

    private Uni<Map<String, Object>> fetchUserinfo(TokenSet tokenSet, Map<String, Object> idTokenClaims) {
        if (metadata.userinfoEndpoint().isEmpty()) {
            return Uni.createFrom().item(idTokenClaims);
        }
        return webClient
                .getAbs(metadata.userinfoEndpoint().get().toString())
                .timeout(timeout.toMillis())
                .putHeader("Accept", "application/json")
                .putHeader("Authorization", "Bearer " + tokenSet.accessToken())
                .send()
                .ifNoItem()
                .after(timeout)
                .failWith(() -> new TokenExchangeException("Timed out loading user profile"))
                .map(response -> {
                    if (response.statusCode() != 200) {
                        LOG.warnf("Userinfo request failed with status %d", response.statusCode());
                        throw new TokenExchangeException("Failed to load user profile from identity provider");
                    }
                    final var userinfo = response.bodyAsJsonObject().getMap();
                    if (!Objects.equals(userinfo.get("sub"), idTokenClaims.get("sub"))) {
                        throw new TokenExchangeException("User profile subject does not match ID token");
                    }
                    final Map<String, Object> merged = new HashMap<>(idTokenClaims);
                    userinfo.forEach((name, value) -> {
                        if (value != null) {
                            merged.put(name, value);
                        }
                    });
                    return merged;
                });
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
