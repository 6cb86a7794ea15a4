package oktaauth.adapter.out.oidc;

import java.net.URI;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKeySet;

import oktaauth.core.config.OktaPluginConfig;
import oktaauth.core.config.PluginConfigurationException;
import oktaauth.core.model.auth.ProviderMetadata;
import oktaauth.core.port.out.ProviderClient;
import oktaauth.core.port.out.ProviderDiscovery;
import oktaauth.core.util.RedirectUrls;

/**
 * OpenID Connect discovery against the configured Okta issuer.
 *
 * <p>Fetches {@code <issuer>/.well-known/openid-configuration}, then the
 * advertised key set, and builds an {@link OktaProviderClient} bound to the
 * redirect URI {@code <externalUrl>/auth/login/plugin/<key>/return}.
 */
@ApplicationScoped
public class OidcDiscoveryClient implements ProviderDiscovery {

    private static final Logger LOG = Logger.getLogger(OidcDiscoveryClient.class);
    static final String WELL_KNOWN_PATH = ".well-known/openid-configuration";

    private final WebClient webClient;
    private final OktaPluginConfig config;
    private final JwksClient jwksClient;

    @Inject
    public OidcDiscoveryClient(WebClient webClient, OktaPluginConfig config) {
        this.webClient = webClient;
        this.config = config;
        this.jwksClient = new JwksClient(webClient, config.timeout());
    }

    @Override
    public Uni<ProviderClient> discover() {
        final var issuer = config.issuer()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new PluginConfigurationException("Issuer URL is not configured"));
        final var discoveryUrl = discoveryUrl(issuer);
        LOG.infof("Fetching OpenID configuration from %s", discoveryUrl);

        return webClient
                .getAbs(discoveryUrl)
                .timeout(config.timeout().toMillis())
                .putHeader("Accept", "application/json")
                .send()
                .ifNoItem()
                .after(config.timeout())
                .failWith(() -> new DiscoveryException("Timeout fetching OpenID configuration from " + discoveryUrl))
                .map(response -> parseMetadata(response, issuer))
                .flatMap(metadata -> jwksClient.fetch(metadata.jwksUri()).map(keys -> createClient(metadata, keys)))
                .onFailure(error -> !(error instanceof DiscoveryException))
                .transform(error -> new DiscoveryException(
                        "Failed to discover identity provider at " + issuer + ": " + error.getMessage(), error));
    }

    /**
     * Discovery document URL for an issuer; a trailing slash on the issuer is
     * tolerated.
     */
    static String discoveryUrl(String issuer) {
        return issuer + (issuer.endsWith("/") ? "" : "/") + WELL_KNOWN_PATH;
    }

    /**
     * Redirect URI registered for this plugin.
     */
    String redirectUri() {
        return RedirectUrls.absolute(
                "/auth/login/plugin/" + config.authPlugin().key() + "/return",
                config.externalUrl().orElse(null));
    }

    /**
     * Whether a discovered issuer names the configured one, ignoring a trailing slash.
     */
    static boolean sameIssuer(String configured, String discovered) {
        return discovered != null && withoutTrailingSlash(configured).equals(withoutTrailingSlash(discovered));
    }

    private static String withoutTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    private ProviderMetadata parseMetadata(HttpResponse<Buffer> response, String configuredIssuer) {
        if (response.statusCode() != 200) {
            throw new DiscoveryException("OpenID configuration endpoint returned status " + response.statusCode());
        }
        final JsonObject json = response.bodyAsJsonObject();
        if (json == null) {
            throw new DiscoveryException("OpenID configuration response is empty");
        }
        final var issuer = json.getString("issuer");
        if (!sameIssuer(configuredIssuer, issuer)) {
            throw new DiscoveryException(
                    "OpenID configuration issuer " + issuer + " does not match configured issuer " + configuredIssuer);
        }
        return new ProviderMetadata(
                issuer,
                requiredUri(json, "authorization_endpoint"),
                requiredUri(json, "token_endpoint"),
                optionalUri(json, "userinfo_endpoint"),
                requiredUri(json, "jwks_uri"),
                optionalUri(json, "end_session_endpoint"));
    }

    private ProviderClient createClient(ProviderMetadata metadata, JsonWebKeySet keys) {
        final var clientId = config.clientId().orElseThrow();
        final var verifier = new IdTokenVerifier(
                jwksClient, metadata.jwksUri(), keys, metadata.issuer(), clientId, config.maxClockSkew());
        return new OktaProviderClient(
                webClient,
                metadata,
                verifier,
                clientId,
                config.clientSecret().orElseThrow(),
                redirectUri(),
                config.timeout());
    }

    private static URI requiredUri(JsonObject json, String field) {
        return optionalUri(json, field)
                .orElseThrow(() -> new DiscoveryException("OpenID configuration is missing " + field));
    }

    private static Optional<URI> optionalUri(JsonObject json, String field) {
        final var value = json.getString(field);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(URI.create(value));
    }
}
