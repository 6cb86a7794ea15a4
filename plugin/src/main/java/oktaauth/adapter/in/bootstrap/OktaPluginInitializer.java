package oktaauth.adapter.in.bootstrap;

import java.net.URI;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import oktaauth.core.config.OktaPluginConfig;
import oktaauth.core.config.PluginConfigurationException;
import oktaauth.core.port.out.ProviderDiscovery.DiscoveryException;
import oktaauth.core.service.auth.OktaAuthenticationService;
import oktaauth.core.service.auth.ProviderClientHolder;
import oktaauth.core.util.SecureHash;

/**
 * Validates configuration and discovers the identity provider on startup.
 *
 * <h2>Failure Behavior</h2>
 * <ul>
 *   <li>Missing client ID, client secret, issuer, external URL or JWT secret: startup FAILS</li>
 *   <li>Provider discovery fails or times out: startup FAILS</li>
 * </ul>
 */
@ApplicationScoped
public class OktaPluginInitializer {

    private static final Logger LOG = Logger.getLogger(OktaPluginInitializer.class);

    private final OktaPluginConfig config;
    private final ProviderClientHolder providerClients;

    @Inject
    public OktaPluginInitializer(OktaPluginConfig config, ProviderClientHolder providerClients) {
        this.config = config;
        this.providerClients = providerClients;
    }

    void onStart(@Observes StartupEvent event) {
        initialize();
    }

    void initialize() {
        try {
            validateConfiguration();
        } catch (PluginConfigurationException e) {
            LOG.error("========================================");
            LOG.errorf("OKTA PLUGIN CONFIGURATION INVALID: %s", e.getMessage());
            LOG.error("========================================");
            throw e; // Re-throw to fail startup
        }

        LOG.infof("Auth plugin key: %s, strategy: %s", config.authPlugin().key(), OktaAuthenticationService.STRATEGY_NAME);
        LOG.infof("Okta clientId: %s", config.clientId().get());
        LOG.infof("Okta client secret fingerprint: %s", SecureHash.fingerprint(config.clientSecret().get()));
        LOG.infof("Okta issuer: %s", config.issuer().get());
        LOG.infof("Timeout setting: %dms", config.timeout().toMillis());
        LOG.infof("Max clock skew: %ds", config.maxClockSkew().toSeconds());
        LOG.infof("Explicit logout: %s", config.authPlugin().explicitLogout());

        try {
            providerClients.initialize();
        } catch (DiscoveryException e) {
            LOG.error("========================================");
            LOG.errorf("OKTA DISCOVERY FAILED: %s", e.getMessage());
            LOG.error("Check okta.issuer and network access to the Okta tenant");
            LOG.error("========================================");
            throw e;
        } catch (RuntimeException e) {
            LOG.error("========================================");
            LOG.errorf(e, "OKTA DISCOVERY FAILED: Unexpected error: %s", e.getMessage());
            LOG.error("========================================");
            throw new DiscoveryException("Identity provider discovery failed unexpectedly", e);
        }
    }

    void validateConfiguration() {
        if (isBlank(config.clientId())) {
            throw new PluginConfigurationException("Required client id (okta.client-id) can't be empty!");
        }
        if (isBlank(config.clientSecret())) {
            throw new PluginConfigurationException("Required client secret (okta.client-secret) can't be empty!");
        }
        if (isBlank(config.issuer())) {
            throw new PluginConfigurationException("Required issuer url (okta.issuer) can't be empty!");
        }
        requireHttpUrl(config.issuer().get(), "okta.issuer");
        if (isBlank(config.externalUrl())) {
            throw new PluginConfigurationException("Required external url (okta.external-url) can't be empty!");
        }
        requireHttpUrl(config.externalUrl().get(), "okta.external-url");
        if (isBlank(config.authorizationApi().jwtSecret())) {
            throw new PluginConfigurationException(
                    "Required JWT secret (okta.authorization-api.jwt-secret) can't be empty!");
        }
    }

    private static void requireHttpUrl(String value, String property) {
        try {
            final var uri = URI.create(value.trim());
            if (uri.getHost() == null
                    || !("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()))) {
                throw new PluginConfigurationException(property + " must be an absolute http(s) URL: " + value);
            }
        } catch (IllegalArgumentException e) {
            throw new PluginConfigurationException(property + " is not a valid URL: " + value, e);
        }
    }

    private static boolean isBlank(Optional<String> value) {
        return value.isEmpty() || value.get().isBlank();
    }
}
