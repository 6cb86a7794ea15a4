package oktaauth.core.config;

/**
 * Exception thrown when required plugin configuration is missing or invalid.
 *
 * <p>Raised during startup; the plugin refuses to serve until it is fixed.
 */
public class PluginConfigurationException extends RuntimeException {

    public PluginConfigurationException(String message) {
        super(message);
    }

    public PluginConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
