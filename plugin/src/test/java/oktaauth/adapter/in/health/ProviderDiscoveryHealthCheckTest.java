package oktaauth.adapter.in.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.net.URI;
import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import oktaauth.core.model.auth.ProviderMetadata;
import oktaauth.core.port.out.ProviderClient;
import oktaauth.core.service.auth.ProviderClientHolder;

@DisplayName("ProviderDiscoveryHealthCheck")
class ProviderDiscoveryHealthCheckTest {

    private ProviderClientHolder providerClients;
    private ProviderDiscoveryHealthCheck healthCheck;

    @BeforeEach
    void setUp() {
        providerClients = mock(ProviderClientHolder.class);
        healthCheck = new ProviderDiscoveryHealthCheck(providerClients);
    }

    @Test
    @DisplayName("should be up once the provider is discovered")
    void shouldBeUpWhenDiscovered() {
        final var client = mock(ProviderClient.class);
        when(client.metadata()).thenReturn(new ProviderMetadata(
                "https://tenant.okta.com",
                URI.create("https://tenant.okta.com/authorize"),
                URI.create("https://tenant.okta.com/token"),
                Optional.empty(),
                URI.create("https://tenant.okta.com/keys"),
                Optional.of(URI.create("https://tenant.okta.com/logout"))));
        when(providerClients.find()).thenReturn(Optional.of(client));

        final var response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals("okta-oidc-discovery", response.getName());
        assertEquals("https://tenant.okta.com", response.getData().orElseThrow().get("issuer"));
    }

    @Test
    @DisplayName("should be down with the last failure before discovery")
    void shouldBeDownBeforeDiscovery() {
        when(providerClients.find()).thenReturn(Optional.empty());
        when(providerClients.lastFailure()).thenReturn(Optional.of("status 503"));

        final var response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.DOWN, response.getStatus());
        assertEquals("status 503", response.getData().orElseThrow().get("error"));
    }
}
