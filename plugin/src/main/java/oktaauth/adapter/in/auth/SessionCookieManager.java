package oktaauth.adapter.in.auth;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.NewCookie;

import oktaauth.core.config.OktaPluginConfig;
import oktaauth.core.config.OktaPluginConfig.SessionConfig.CookieConfig;
import oktaauth.core.model.session.Session;

/**
 * Manages session cookies - creation, extraction, and invalidation.
 */
@ApplicationScoped
public class SessionCookieManager {

    private final CookieConfig cookieConfig;

    @Inject
    public SessionCookieManager(OktaPluginConfig config) {
        this.cookieConfig = config.session().cookie();
    }

    /**
     * Creates a session cookie for the given session.
     *
     * @param session The session to create a cookie for
     * @return The session cookie, expiring with the session
     */
    public NewCookie createCookie(Session session) {
        final var builder = baseCookie(session.id());
        if (session.expiresAt() != null) {
            final var maxAge = session.expiresAt().getEpochSecond() - Instant.now().getEpochSecond();
            if (maxAge > 0) {
                builder.maxAge((int) Math.min(maxAge, Integer.MAX_VALUE));
            }
        }
        return builder.build();
    }

    /**
     * Creates a logout cookie that expires immediately.
     *
     * @return Cookie that clears the session
     */
    public NewCookie createLogoutCookie() {
        return baseCookie("").maxAge(0).build();
    }

    /**
     * Extracts the session ID from request cookies.
     *
     * @param cookies Cookies of the request, by name
     * @return The session ID, or empty if not present
     */
    public Optional<String> extractSessionId(Map<String, Cookie> cookies) {
        final var cookie = cookies == null ? null : cookies.get(cookieConfig.name());
        if (cookie == null || cookie.getValue() == null || cookie.getValue().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(cookie.getValue());
    }

    private NewCookie.Builder baseCookie(String value) {
        final var builder = new NewCookie.Builder(cookieConfig.name())
                .value(value)
                .path(cookieConfig.path())
                .secure(cookieConfig.secure())
                .httpOnly(cookieConfig.httpOnly())
                .sameSite(parseSameSite(cookieConfig.sameSite()));
        cookieConfig.domain().ifPresent(builder::domain);
        return builder;
    }

    private NewCookie.SameSite parseSameSite(String sameSite) {
        return switch (sameSite.toUpperCase()) {
            case "STRICT" -> NewCookie.SameSite.STRICT;
            case "NONE" -> NewCookie.SameSite.NONE;
            default -> NewCookie.SameSite.LAX;
        };
    }
}
