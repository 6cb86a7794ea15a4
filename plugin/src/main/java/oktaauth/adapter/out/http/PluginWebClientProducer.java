package oktaauth.adapter.out.http;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import oktaauth.core.config.OktaPluginConfig;

/**
 * Provides the single HTTP client used for the identity provider and the
 * authorization API.
 *
 * <p>Every request carries a User-Agent identifying the plugin, its version
 * and the runtime, e.g.
 * {@code okta-auth-plugin/1.1.1 vertx-web-client java/17.0.9 Linux/6.1.0}.
 */
@ApplicationScoped
public class PluginWebClientProducer {

    @Produces
    @Singleton
    public WebClient webClient(
            Vertx vertx,
            OktaPluginConfig config,
            @ConfigProperty(name = "quarkus.application.name", defaultValue = "okta-auth-plugin") String name,
            @ConfigProperty(name = "quarkus.application.version", defaultValue = "unknown") String version) {
        return WebClient.create(vertx, options(config, userAgent(name, version)));
    }

    void close(@Disposes WebClient webClient) {
        webClient.close();
    }

    /**
     * Client options bounded by the configured timeout.
     */
    public static WebClientOptions options(OktaPluginConfig config, String userAgent) {
        return new WebClientOptions()
                .setUserAgentEnabled(true)
                .setUserAgent(userAgent)
                .setConnectTimeout((int) config.timeout().toMillis());
    }

    public static String userAgent(String name, String version) {
        return name + "/" + version
                + " vertx-web-client"
                + " java/" + System.getProperty("java.version")
                + " " + System.getProperty("os.name") + "/" + System.getProperty("os.version");
    }
}
