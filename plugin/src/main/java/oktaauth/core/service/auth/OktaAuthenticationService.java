package oktaauth.core.service.auth;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import oktaauth.core.config.OktaPluginConfig;
import oktaauth.core.model.auth.AuthPluginData;
import oktaauth.core.model.auth.AuthenticationFlowException;
import oktaauth.core.model.auth.FlowOutcome;
import oktaauth.core.model.auth.MissingEmailException;
import oktaauth.core.model.auth.ProviderCallback;
import oktaauth.core.model.auth.TokenExchangeException;
import oktaauth.core.model.auth.TokenExchangeResult;
import oktaauth.core.model.auth.TokenSet;
import oktaauth.core.model.auth.UserProfile;
import oktaauth.core.model.session.Session;
import oktaauth.core.model.session.SessionPayload;
import oktaauth.core.port.in.AuthenticationFlow;
import oktaauth.core.port.out.ProviderDiscovery.DiscoveryException;
import oktaauth.core.port.out.SessionStore;
import oktaauth.core.port.out.UserTokenResolver;
import oktaauth.core.util.RedirectUrls;

/**
 * The {@code okta-oidc} authentication strategy.
 *
 * <p>Login: the destination is signed into {@code state}, the browser goes
 * to Okta, and on return the code is exchanged, the user is resolved to a
 * local account and a session is established. Logout: the local session is
 * destroyed, then the browser goes through Okta's end-session endpoint and
 * back to the destination.
 *
 * <p>Every step ends in a redirect. Login failures go to the destination
 * with {@code result=failure&errorMessage=...} and never leave a session.
 */
@ApplicationScoped
public class OktaAuthenticationService implements AuthenticationFlow {

    public static final String STRATEGY_NAME = "okta-oidc";

    static final String GENERIC_FAILURE_MESSAGE = "Authentication failed";
    static final String PROVIDER_UNAVAILABLE_MESSAGE = "Identity provider is not available";

    private static final Logger LOG = Logger.getLogger(OktaAuthenticationService.class);

    private final OktaPluginConfig config;
    private final ProviderClientHolder providerClients;
    private final RedirectStateCodec stateCodec;
    private final UserTokenResolver userTokenResolver;
    private final SessionStore sessionStore;

    public OktaAuthenticationService(
            OktaPluginConfig config,
            ProviderClientHolder providerClients,
            RedirectStateCodec stateCodec,
            UserTokenResolver userTokenResolver,
            SessionStore sessionStore) {
        this.config = config;
        this.providerClients = providerClients;
        this.stateCodec = stateCodec;
        this.userTokenResolver = userTokenResolver;
        this.sessionStore = sessionStore;
    }

    public String name() {
        return STRATEGY_NAME;
    }

    @Override
    public Uni<FlowOutcome> initiate(String redirect) {
        final var destination = resolveDestination(redirect);
        return Uni.createFrom()
                .item(() -> {
                    final var client = providerClients.current();
                    final var state = stateCodec.encode(destination);
                    LOG.debugf("Starting login, destination=%s", destination);
                    return FlowOutcome.redirect(
                            client.authorizationUrl(config.scope(), state).toString());
                })
                .onFailure()
                .recoverWithItem(error -> failure(destination, error));
    }

    @Override
    public Uni<FlowOutcome> complete(ProviderCallback callback) {
        final var verifiedDestination = stateCodec.decode(callback.state());
        final var destination = verifiedDestination.orElseGet(this::defaultDestination);

        if (verifiedDestination.isEmpty()) {
            return Uni.createFrom()
                    .item(failure(destination, new TokenExchangeException("Invalid or missing login state")));
        }
        if (callback.hasError()) {
            final var description = callback.errorDescription() == null ? "" : ": " + callback.errorDescription();
            return Uni.createFrom()
                    .item(failure(
                            destination,
                            new TokenExchangeException("Identity provider returned " + callback.error() + description)));
        }
        if (!callback.hasCode()) {
            return Uni.createFrom()
                    .item(failure(destination, new TokenExchangeException("Missing authorization code")));
        }

        return Uni.createFrom()
                .deferred(() -> providerClients.current().exchangeCode(callback.code()))
                .flatMap(this::authenticate)
                .map(session -> {
                    LOG.infof(
                            "Login succeeded for user %s",
                            session.payload().userToken().id());
                    return FlowOutcome.established(destination, session);
                })
                .onFailure()
                .recoverWithItem(error -> failure(destination, error));
    }

    @Override
    public Uni<FlowOutcome> logout(Optional<String> sessionId, String redirect) {
        return destroy(sessionId).map(destroyed -> {
            final var tokenSet = destroyed.flatMap(
                    session -> session.payload().authPlugin().tokenSet());
            if (tokenSet.isEmpty()) {
                return FlowOutcome.cleared(resolveDestination(redirect));
            }
            return FlowOutcome.cleared(endSessionLocation(tokenSet.get(), redirect)
                    .orElseGet(() -> resolveDestination(redirect)));
        });
    }

    @Override
    public Uni<FlowOutcome> logoutReturn(Optional<String> sessionId, String redirect) {
        return destroy(sessionId).map(destroyed -> FlowOutcome.cleared(resolveDestination(redirect)));
    }

    private Uni<Session> authenticate(TokenExchangeResult result) {
        final var pluginKey = config.authPlugin().key();
        final var profile = UserProfile.fromClaims(result.claims(), pluginKey);
        if (!profile.hasEmail()) {
            throw new MissingEmailException();
        }
        return userTokenResolver
                .resolveOrCreateUser(profile, pluginKey)
                .flatMap(userToken -> sessionStore.establish(
                        new SessionPayload(userToken, authPluginData(result.tokenSet()))));
    }

    AuthPluginData authPluginData(TokenSet tokenSet) {
        final var key = config.authPlugin().key();
        final var logoutUrl = config.authPlugin().explicitLogout()
                ? Optional.of("/auth/plugin/" + key + "/logout")
                : Optional.<String>empty();
        return new AuthPluginData(key, Optional.of(tokenSet), logoutUrl);
    }

    private Optional<String> endSessionLocation(TokenSet tokenSet, String redirect) {
        final var client = providerClients.find();
        if (client.isEmpty()) {
            LOG.warn("Identity provider not discovered, skipping provider logout");
            return Optional.empty();
        }
        // the nested destination stays relative; logout-return resolves it
        final var nestedDestination = RedirectUrls.determine(redirect, config.authPluginRedirectUrl(), null);
        final var callback = RedirectUrls.absolute(
                "/auth/plugin/" + config.authPlugin().key() + "/logout/return",
                externalUrl(),
                Map.of("redirect", nestedDestination));
        final var endSessionUrl = client.get().endSessionUrl(tokenSet, callback);
        if (endSessionUrl.isEmpty()) {
            LOG.debug("Identity provider advertises no end-session endpoint");
        }
        return endSessionUrl.map(Object::toString);
    }

    private Uni<Optional<Session>> destroy(Optional<String> sessionId) {
        if (sessionId.isEmpty()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return sessionStore.destroy(sessionId.get()).onFailure().recoverWithItem(error -> {
            LOG.warnf(error, "Failed to destroy session during logout");
            return Optional.empty();
        });
    }

    private FlowOutcome failure(String destination, Throwable error) {
        final String message;
        if (error instanceof AuthenticationFlowException) {
            message = error.getMessage();
            LOG.warnf("Login failed: %s", describe(error));
        } else if (error instanceof DiscoveryException) {
            message = PROVIDER_UNAVAILABLE_MESSAGE;
            LOG.errorf("Login failed, provider unavailable: %s", error.getMessage());
        } else {
            message = GENERIC_FAILURE_MESSAGE;
            LOG.errorf(error, "Login failed with unexpected error");
        }
        final var queries = new LinkedHashMap<String, String>();
        queries.put("result", "failure");
        queries.put("errorMessage", message);
        return FlowOutcome.redirect(RedirectUrls.withQuery(destination, queries));
    }

    private static String describe(Throwable error) {
        if (error.getCause() == null) {
            return error.getMessage();
        }
        return error.getMessage() + " (" + error.getCause().getMessage() + ")";
    }

    private String resolveDestination(String redirect) {
        return RedirectUrls.determine(redirect, config.authPluginRedirectUrl(), externalUrl());
    }

    private String defaultDestination() {
        return RedirectUrls.absolute(config.authPluginRedirectUrl(), externalUrl());
    }

    private String externalUrl() {
        return config.externalUrl().orElse(null);
    }
}
