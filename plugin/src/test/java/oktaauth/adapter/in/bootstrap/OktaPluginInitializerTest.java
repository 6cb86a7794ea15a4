package oktaauth.adapter.in.bootstrap;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import oktaauth.core.config.AuthPluginConfig;
import oktaauth.core.config.OktaPluginConfig;
import oktaauth.core.config.OktaPluginConfig.AuthorizationApiConfig;
import oktaauth.core.config.PluginConfigurationException;
import oktaauth.core.port.out.ProviderDiscovery.DiscoveryException;
import oktaauth.core.service.auth.ProviderClientHolder;

@DisplayName("OktaPluginInitializer")
@ExtendWith(MockitoExtension.class)
class OktaPluginInitializerTest {

    @Mock
    private OktaPluginConfig config;

    @Mock
    private AuthPluginConfig pluginConfig;

    @Mock
    private AuthorizationApiConfig apiConfig;

    @Mock
    private ProviderClientHolder providerClients;

    private OktaPluginInitializer initializer;

    @BeforeEach
    void setUp() {
        lenient().when(config.clientId()).thenReturn(Optional.of("client"));
        lenient().when(config.clientSecret()).thenReturn(Optional.of("secret"));
        lenient().when(config.issuer()).thenReturn(Optional.of("https://tenant.okta.com/oauth2/default"));
        lenient().when(config.externalUrl()).thenReturn(Optional.of("https://example.org"));
        lenient().when(config.timeout()).thenReturn(Duration.ofSeconds(10));
        lenient().when(config.maxClockSkew()).thenReturn(Duration.ofSeconds(120));
        lenient().when(config.authPlugin()).thenReturn(pluginConfig);
        lenient().when(config.authorizationApi()).thenReturn(apiConfig);
        lenient().when(pluginConfig.key()).thenReturn("okta");
        lenient().when(apiConfig.jwtSecret()).thenReturn(Optional.of("squirrel"));

        initializer = new OktaPluginInitializer(config, providerClients);
    }

    @Nested
    @DisplayName("Configuration validation")
    class Validation {

        @Test
        @DisplayName("should accept a complete configuration")
        void shouldAcceptCompleteConfiguration() {
            assertDoesNotThrow(initializer::validateConfiguration);
        }

        @Test
        @DisplayName("should require a client ID")
        void shouldRequireClientId() {
            when(config.clientId()).thenReturn(Optional.empty());

            final var error = assertThrows(PluginConfigurationException.class, initializer::initialize);

            assertEquals("Required client id (okta.client-id) can't be empty!", error.getMessage());
            verify(providerClients, never()).initialize();
        }

        @Test
        @DisplayName("should require a client secret")
        void shouldRequireClientSecret() {
            when(config.clientSecret()).thenReturn(Optional.of("  "));

            final var error = assertThrows(PluginConfigurationException.class, initializer::validateConfiguration);

            assertEquals("Required client secret (okta.client-secret) can't be empty!", error.getMessage());
        }

        @Test
        @DisplayName("should require an issuer")
        void shouldRequireIssuer() {
            when(config.issuer()).thenReturn(Optional.empty());

            final var error = assertThrows(PluginConfigurationException.class, initializer::validateConfiguration);

            assertEquals("Required issuer url (okta.issuer) can't be empty!", error.getMessage());
        }

        @Test
        @DisplayName("should require an absolute issuer URL")
        void shouldRequireAbsoluteIssuer() {
            when(config.issuer()).thenReturn(Optional.of("tenant.okta.com"));

            assertThrows(PluginConfigurationException.class, initializer::validateConfiguration);
        }

        @Test
        @DisplayName("should require an external URL")
        void shouldRequireExternalUrl() {
            when(config.externalUrl()).thenReturn(Optional.empty());

            assertThrows(PluginConfigurationException.class, initializer::validateConfiguration);
        }

        @Test
        @DisplayName("should require the authorization API JWT secret")
        void shouldRequireJwtSecret() {
            when(apiConfig.jwtSecret()).thenReturn(Optional.empty());

            assertThrows(PluginConfigurationException.class, initializer::validateConfiguration);
        }
    }

    @Nested
    @DisplayName("Discovery")
    class Discovery {

        @Test
        @DisplayName("should discover the provider after validation")
        void shouldDiscover() {
            initializer.initialize();

            verify(providerClients).initialize();
        }

        @Test
        @DisplayName("should fail startup when discovery fails")
        void shouldFailStartupOnDiscoveryFailure() {
            when(providerClients.initialize()).thenThrow(new DiscoveryException("status 503"));

            final var error = assertThrows(DiscoveryException.class, initializer::initialize);

            assertEquals("status 503", error.getMessage());
        }

        @Test
        @DisplayName("should wrap unexpected discovery errors")
        void shouldWrapUnexpectedErrors() {
            when(providerClients.initialize()).thenThrow(new IllegalStateException("boom"));

            final var error = assertThrows(DiscoveryException.class, initializer::initialize);

            assertEquals(IllegalStateException.class, error.getCause().getClass());
        }
    }
}
