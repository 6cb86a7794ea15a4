package oktaauth.core.service.auth;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.TimeoutException;
import org.jboss.logging.Logger;

import oktaauth.core.config.OktaPluginConfig;
import oktaauth.core.port.out.ProviderClient;
import oktaauth.core.port.out.ProviderDiscovery;
import oktaauth.core.port.out.ProviderDiscovery.DiscoveryException;

/**
 * Holds the provider client discovered at startup.
 *
 * <p>Discovery runs once; there is no hot reload. Until it succeeds every
 * request that needs the provider fails fast with {@link DiscoveryException}.
 */
@ApplicationScoped
public class ProviderClientHolder {

    private static final Logger LOG = Logger.getLogger(ProviderClientHolder.class);

    private final ProviderDiscovery discovery;
    private final OktaPluginConfig config;
    private final AtomicReference<ProviderClient> client = new AtomicReference<>();
    private volatile String lastFailure;

    public ProviderClientHolder(ProviderDiscovery discovery, OktaPluginConfig config) {
        this.discovery = discovery;
        this.config = config;
    }

    /**
     * Run discovery and keep the resulting client. Blocks; call from startup only.
     *
     * @return The discovered client
     * @throws DiscoveryException if discovery fails or does not finish in time
     */
    public ProviderClient initialize() {
        final var existing = client.get();
        if (existing != null) {
            return existing;
        }
        // metadata and key set are two requests, each bounded by the timeout
        final var bound = config.timeout().multipliedBy(2);
        try {
            final var discovered = discovery.discover().await().atMost(bound);
            client.set(discovered);
            lastFailure = null;
            LOG.infof(
                    "Identity provider discovered: issuer=%s, redirectUri=%s",
                    discovered.metadata().issuer(), discovered.redirectUri());
            return discovered;
        } catch (TimeoutException e) {
            lastFailure = "Discovery timed out after " + bound.toMillis() + "ms";
            throw new DiscoveryException(lastFailure, e);
        } catch (DiscoveryException e) {
            lastFailure = e.getMessage();
            throw e;
        }
    }

    /**
     * The discovered client.
     *
     * @throws DiscoveryException if discovery has not completed
     */
    public ProviderClient current() {
        return find().orElseThrow(() -> new DiscoveryException("Identity provider discovery has not completed"));
    }

    public Optional<ProviderClient> find() {
        return Optional.ofNullable(client.get());
    }

    public Optional<String> lastFailure() {
        return Optional.ofNullable(lastFailure);
    }
}
