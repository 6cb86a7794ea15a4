package oktaauth.adapter.in.dto;

/**
 * Plugin descriptor returned to the gateway by {@code GET /config}.
 */
public record AuthPluginDescriptor(String key, String name, String iconUrl, String authenticationMethod) {

    public static final String IDP_URI_REDIRECTION = "IDP-URI-REDIRECTION";
}
