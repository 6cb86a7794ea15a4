package oktaauth.core.config;

import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Descriptor of an authentication plugin as seen by the gateway.
 *
 * <p>Composed into {@link OktaPluginConfig} under {@code okta.auth-plugin}.
 */
public interface AuthPluginConfig {

    /**
     * Plugin key. Used in route paths, as the user source and as the
     * provider name of authenticated profiles.
     *
     * @return Plugin key (default: okta)
     */
    @WithDefault("okta")
    String key();

    @WithDefault("Okta")
    String name();

    @WithName("icon-url")
    @WithDefault("/icon.svg")
    String iconUrl();

    /**
     * Whether the gateway must call this plugin's logout route to end the
     * provider session.
     *
     * @return true to attach a logout URL to sessions (default: true)
     */
    @WithName("explicit-logout")
    @WithDefault("true")
    boolean explicitLogout();
}
