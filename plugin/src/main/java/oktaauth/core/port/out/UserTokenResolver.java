package oktaauth.core.port.out;

import io.smallrye.mutiny.Uni;

import oktaauth.core.model.auth.UserProfile;
import oktaauth.core.model.auth.UserToken;

/**
 * Port for mapping a provider identity to a local user.
 */
public interface UserTokenResolver {

    /**
     * Find the local user for the profile, creating it when absent.
     *
     * <p>Idempotent per (source, subject).
     *
     * @param profile Authenticated profile
     * @param source Plugin key recorded as the user's source
     * @return Uni with the local user token, failing with
     *     {@link oktaauth.core.model.auth.IdentityResolutionException}
     */
    Uni<UserToken> resolveOrCreateUser(UserProfile profile, String source);
}
