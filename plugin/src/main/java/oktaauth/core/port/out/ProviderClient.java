package oktaauth.core.port.out;

import java.net.URI;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import oktaauth.core.model.auth.ProviderMetadata;
import oktaauth.core.model.auth.TokenExchangeResult;
import oktaauth.core.model.auth.TokenSet;

/**
 * Client bound to one discovered identity provider, one client registration
 * and one redirect URI.
 */
public interface ProviderClient {

    ProviderMetadata metadata();

    /**
     * The redirect URI sent with authorization requests and code exchanges.
     */
    String redirectUri();

    /**
     * Build the authorization request URL.
     *
     * @param scope Requested scopes
     * @param state Opaque state returned by the provider unmodified
     * @return Authorization endpoint URL
     */
    URI authorizationUrl(String scope, String state);

    /**
     * Exchange an authorization code and verify the returned tokens.
     *
     * @param code Authorization code
     * @return Uni with tokens and verified claims, failing with
     *     {@link oktaauth.core.model.auth.TokenExchangeException}
     */
    Uni<TokenExchangeResult> exchangeCode(String code);

    /**
     * Build the RP-initiated logout URL.
     *
     * @param tokenSet Tokens of the session being ended
     * @param postLogoutRedirect Where the provider sends the browser afterwards
     * @return End-session URL, or empty if the provider has no end-session endpoint
     */
    Optional<URI> endSessionUrl(TokenSet tokenSet, String postLogoutRedirect);
}
