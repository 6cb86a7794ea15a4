package oktaauth.core.port.out;

import io.smallrye.mutiny.Uni;

/**
 * Port for discovering the identity provider and building a client for it.
 */
public interface ProviderDiscovery {

    /**
     * Fetch the provider's OpenID configuration and signing keys.
     *
     * @return Uni with a client bound to the discovered provider, failing
     *     with {@link DiscoveryException}
     */
    Uni<ProviderClient> discover();

    /**
     * Exception thrown when provider metadata cannot be fetched or parsed,
     * or when the provider is used before discovery has completed.
     */
    class DiscoveryException extends RuntimeException {

        public DiscoveryException(String message) {
            super(message);
        }

        public DiscoveryException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
