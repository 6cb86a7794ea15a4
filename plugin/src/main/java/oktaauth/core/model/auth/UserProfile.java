package oktaauth.core.model.auth;

import java.util.Map;

/**
 * Identity of an authenticated user, projected from provider claims.
 *
 * @param id Subject identifier at the provider ({@code sub})
 * @param provider Plugin key the user authenticated through
 * @param displayName Full name ({@code name})
 * @param givenName Given name
 * @param familyName Family name
 * @param email Email address
 */
public record UserProfile(
        String id, String provider, String displayName, String givenName, String familyName, String email) {

    /**
     * Project OIDC standard claims into a profile.
     */
    public static UserProfile fromClaims(Map<String, Object> claims, String provider) {
        return new UserProfile(
                stringClaim(claims, "sub"),
                provider,
                stringClaim(claims, "name"),
                stringClaim(claims, "given_name"),
                stringClaim(claims, "family_name"),
                stringClaim(claims, "email"));
    }

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }

    /**
     * Display name, falling back to the email address.
     */
    public String displayNameOrEmail() {
        return displayName != null && !displayName.isBlank() ? displayName : email;
    }

    private static String stringClaim(Map<String, Object> claims, String name) {
        final var value = claims.get(name);
        return value == null ? null : value.toString();
    }
}
