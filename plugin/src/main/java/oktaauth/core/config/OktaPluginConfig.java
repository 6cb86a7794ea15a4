package oktaauth.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for the Okta authentication plugin.
 *
 * <p>Configuration prefix: {@code okta}
 *
 * <p>Required values ({@code issuer}, {@code client-id}, {@code client-secret},
 * {@code external-url}) are validated at startup rather than by the mapping,
 * so a missing value produces a readable error instead of a mapping failure.
 */
@ConfigMapping(prefix = "okta")
public interface OktaPluginConfig {

    /**
     * Issuer URL of the Okta authorization server, e.g.
     * {@code https://dev-123.okta.com/oauth2/default}.
     *
     * @return Issuer URL
     */
    Optional<String> issuer();

    /**
     * OAuth2 client ID registered with Okta.
     *
     * @return Client ID
     */
    @WithName("client-id")
    Optional<String> clientId();

    /**
     * OAuth2 client secret.
     *
     * <p>Also keys the signature of the {@code state} parameter.
     *
     * @return Client secret
     */
    @WithName("client-secret")
    Optional<String> clientSecret();

    /**
     * Public base URL of the gateway, used to build absolute redirect URLs.
     *
     * @return External base URL
     */
    @WithName("external-url")
    Optional<String> externalUrl();

    /**
     * Default destination after login or logout when no {@code redirect}
     * query parameter is given.
     *
     * @return Default redirect URL (default: /sign-in-redirect)
     */
    @WithName("auth-plugin-redirect-url")
    @WithDefault("/sign-in-redirect")
    String authPluginRedirectUrl();

    /**
     * Scopes requested at authorization.
     *
     * @return Space separated scopes (default: openid profile email)
     */
    @WithDefault("openid profile email")
    String scope();

    /**
     * Timeout applied to every call to the identity provider and the
     * authorization API.
     *
     * @return Timeout (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration timeout();

    /**
     * Clock skew tolerated when validating ID token time claims.
     *
     * @return Max clock skew (default: 120 seconds)
     */
    @WithName("max-clock-skew")
    @WithDefault("PT120S")
    Duration maxClockSkew();

    /**
     * Plugin descriptor exposed to the gateway.
     */
    @WithName("auth-plugin")
    AuthPluginConfig authPlugin();

    /**
     * Authorization API used to look up or create local users.
     */
    @WithName("authorization-api")
    AuthorizationApiConfig authorizationApi();

    /**
     * Session storage and cookie settings.
     */
    SessionConfig session();

    /**
     * Authorization API settings.
     */
    interface AuthorizationApiConfig {

        /**
         * Base URL of the authorization API.
         *
         * @return Base URL (default: http://authorization-api/v0)
         */
        @WithName("base-url")
        @WithDefault("http://authorization-api/v0")
        String baseUrl();

        /**
         * Secret used to sign the internal session header.
         *
         * @return JWT secret
         */
        @WithName("jwt-secret")
        Optional<String> jwtSecret();

        /**
         * User ID the plugin acts as when calling the authorization API.
         *
         * @return Acting user ID
         */
        @WithName("user-id")
        @WithDefault("00000000-0000-4000-8000-000000000000")
        String userId();
    }

    /**
     * Session settings.
     */
    interface SessionConfig {

        /**
         * Session lifetime.
         *
         * @return TTL (default: 7 days)
         */
        @WithDefault("P7D")
        Duration ttl();

        /**
         * Interval between sweeps of expired sessions.
         *
         * @return Cleanup interval (default: 5 minutes)
         */
        @WithName("cleanup-interval")
        @WithDefault("PT5M")
        Duration cleanupInterval();

        CookieConfig cookie();

        interface CookieConfig {

            @WithDefault("connect.sid")
            String name();

            @WithDefault("/")
            String path();

            Optional<String> domain();

            @WithDefault("false")
            boolean secure();

            @WithName("http-only")
            @WithDefault("true")
            boolean httpOnly();

            /**
             * SameSite attribute: strict, lax or none.
             *
             * @return SameSite value (default: lax)
             */
            @WithName("same-site")
            @WithDefault("lax")
            String sameSite();
        }
    }
}
