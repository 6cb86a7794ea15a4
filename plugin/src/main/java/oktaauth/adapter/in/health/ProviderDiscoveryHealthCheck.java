package oktaauth.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import oktaauth.core.service.auth.ProviderClientHolder;

/**
 * Readiness check reporting whether the identity provider has been discovered.
 *
 * <p>Logins cannot start before discovery, so the plugin is not ready until then.
 */
@Readiness
@ApplicationScoped
public class ProviderDiscoveryHealthCheck implements HealthCheck {

    static final String NAME = "okta-oidc-discovery";

    private final ProviderClientHolder providerClients;

    @Inject
    public ProviderDiscoveryHealthCheck(ProviderClientHolder providerClients) {
        this.providerClients = providerClients;
    }

    @Override
    public HealthCheckResponse call() {
        final var builder = HealthCheckResponse.builder().name(NAME);
        final var client = providerClients.find();
        if (client.isPresent()) {
            return builder.withData("issuer", client.get().metadata().issuer())
                    .withData("endSessionSupported", client.get().metadata().endSessionEndpoint().isPresent())
                    .up()
                    .build();
        }
        return builder.withData("error", providerClients.lastFailure().orElse("Discovery has not completed"))
                .down()
                .build();
    }
}
