package oktaauth.adapter.in.http;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import oktaauth.adapter.in.auth.SessionCookieManager;
import oktaauth.adapter.in.dto.AuthPluginDescriptor;
import oktaauth.core.config.OktaPluginConfig;
import oktaauth.core.model.auth.FlowOutcome;
import oktaauth.core.model.auth.ProviderCallback;
import oktaauth.core.port.in.AuthenticationFlow;

/**
 * Browser-facing routes of the Okta authentication plugin.
 *
 * <p>The gateway mounts these under {@code /auth/login/plugin/<key>} (login)
 * and {@code /auth/plugin/<key>} (logout). Every flow route answers
 * {@code 302 Found}.
 */
@Path("/")
public class AuthPluginResource {

    private final AuthenticationFlow authenticationFlow;
    private final SessionCookieManager cookieManager;
    private final OktaPluginConfig config;

    @Inject
    public AuthPluginResource(
            AuthenticationFlow authenticationFlow, SessionCookieManager cookieManager, OktaPluginConfig config) {
        this.authenticationFlow = authenticationFlow;
        this.cookieManager = cookieManager;
        this.config = config;
    }

    /**
     * Start login: redirect to Okta's authorization endpoint.
     */
    @GET
    public Uni<Response> login(@QueryParam("redirect") String redirect) {
        return authenticationFlow.initiate(redirect).map(this::toResponse);
    }

    /**
     * Okta redirects here after the user authenticated or refused.
     */
    @GET
    @Path("return")
    public Uni<Response> loginReturn(
            @QueryParam("code") String code,
            @QueryParam("state") String state,
            @QueryParam("error") String error,
            @QueryParam("error_description") String errorDescription) {
        return authenticationFlow
                .complete(new ProviderCallback(code, state, error, errorDescription))
                .map(this::toResponse);
    }

    @GET
    @Path("logout")
    public Uni<Response> logout(@QueryParam("redirect") String redirect, @Context HttpHeaders headers) {
        final var sessionId = cookieManager.extractSessionId(headers.getCookies());
        return authenticationFlow.logout(sessionId, redirect).map(this::toResponse);
    }

    @GET
    @Path("logout/return")
    public Uni<Response> logoutReturn(@QueryParam("redirect") String redirect, @Context HttpHeaders headers) {
        final var sessionId = cookieManager.extractSessionId(headers.getCookies());
        return authenticationFlow.logoutReturn(sessionId, redirect).map(this::toResponse);
    }

    @GET
    @Path("config")
    @Produces(MediaType.APPLICATION_JSON)
    public AuthPluginDescriptor pluginConfig() {
        final var plugin = config.authPlugin();
        return new AuthPluginDescriptor(
                plugin.key(), plugin.name(), plugin.iconUrl(), AuthPluginDescriptor.IDP_URI_REDIRECTION);
    }

    private Response toResponse(FlowOutcome outcome) {
        final var builder =
                Response.status(Response.Status.FOUND).header(HttpHeaders.LOCATION, outcome.location());
        outcome.establishedSession().ifPresent(session -> builder.cookie(cookieManager.createCookie(session)));
        if (outcome.sessionCleared()) {
            builder.cookie(cookieManager.createLogoutCookie());
        }
        return builder.build();
    }
}
