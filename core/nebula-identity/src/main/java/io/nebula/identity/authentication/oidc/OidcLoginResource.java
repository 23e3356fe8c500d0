package io.nebula.identity.authentication.oidc;

import io.nebula.identity.authentication.AuthException;
import io.nebula.identity.authentication.BaseUrlResolver;
import io.nebula.identity.session.SessionContext;
import io.nebula.identity.session.SessionCookies;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.*;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * OIDC Federation Login Resource.
 *
 * Handles login flows where this service acts as an OIDC client of the
 * configured identity provider.
 *
 * Flow:
 * 1. GET /auth/sso/login?returnTo=/dashboard - Redirects to the provider
 * 2. User authenticates at the provider
 * 3. GET /auth/sso/callback?code=...&state=... - Provisions the user, creates session
 */
@Path("/auth/sso")
@Tag(name = "OIDC Federation", description = "External identity provider login endpoints")
@Produces(MediaType.APPLICATION_JSON)
public class OidcLoginResource {

    private static final Logger LOG = Logger.getLogger(OidcLoginResource.class);
    static final String LOGIN_PAGE = "/login";
    static final String GENERIC_ERROR = "authentication_failed";

    @Inject
    FederatedLoginService federatedLoginService;

    @Inject
    SessionContext sessionContext;

    @Inject
    SessionCookies sessionCookies;

    @Inject
    BaseUrlResolver baseUrlResolver;

    @Context
    UriInfo uriInfo;

    @Context
    HttpHeaders headers;

    // ==================== Login Initiation ====================

    /**
     * Redirect the browser to the identity provider.
     */
    @GET
    @Path("/login")
    @Operation(summary = "Start SSO login", description = "Redirects to the identity provider for authentication")
    public Response login(
            @Parameter(description = "Local path to return to after login")
            @QueryParam("returnTo") String returnTo
    ) {
        try {
            FederatedLoginService.LoginRedirect redirect = federatedLoginService.beginLogin(
                sessionContext.sessionId(), returnTo, baseUrl());

            return Response.seeOther(URI.create(redirect.authorizationUrl()))
                .cookie(sessionCookies.issue(redirect.session()))
                .build();
        } catch (AuthException e) {
            LOG.warnf("SSO login could not start: %s", e.failure().code());
            return errorRedirect(e.failure().code());
        }
    }

    // ==================== Callback Handler ====================

    /**
     * Handle the provider callback. Exchanges the code, provisions the user and
     * replaces the session cookie.
     */
    @GET
    @Path("/callback")
    @Operation(summary = "SSO callback", description = "Handles the callback from the identity provider")
    public Response callback(
            @QueryParam("code") String code,
            @QueryParam("state") String state,
            @QueryParam("error") String error,
            @QueryParam("error_description") String errorDescription
    ) {
        try {
            FederatedLoginService.CompletedLogin completed = federatedLoginService.completeLogin(
                sessionContext.sessionId(),
                new FederatedLoginService.CallbackParameters(code, state, error, errorDescription),
                baseUrl()
            );

            return Response.seeOther(URI.create(completed.redirectTo()))
                .cookie(sessionCookies.issue(completed.session()))
                .build();
        } catch (AuthException e) {
            LOG.warnf("SSO callback failed: %s (%s)", e.failure().code(), e.detail());
            return errorRedirect(e.failure().code());
        } catch (Exception e) {
            LOG.errorf(e, "Unexpected error during SSO callback");
            return errorRedirect(GENERIC_ERROR);
        }
    }

    // ==================== Status & Logout ====================

    @GET
    @Path("/status")
    @Operation(summary = "SSO availability")
    public StatusResponse status() {
        return new StatusResponse(federatedLoginService.isEnabled(), federatedLoginService.isConfigured());
    }

    /**
     * End the local session. The client navigates to the returned URL to end
     * the provider session as well.
     */
    @POST
    @Path("/logout")
    @Operation(summary = "SSO logout", description = "Ends the session and returns the provider logout URL")
    public Response logout() {
        String logoutUrl = federatedLoginService.logout(sessionContext.sessionId(), baseUrl());
        return Response.ok(new LogoutResponse(logoutUrl))
            .cookie(sessionCookies.expire())
            .build();
    }

    @GET
    @Path("/logout-complete")
    @Operation(summary = "Post-logout landing", description = "Target of the provider's post-logout redirect")
    public Response logoutComplete() {
        return Response.seeOther(URI.create(LOGIN_PAGE + "?message=signed_out"))
            .cookie(sessionCookies.expire())
            .build();
    }

    // ==================== Helpers ====================

    private String baseUrl() {
        return baseUrlResolver.resolve(headers, uriInfo);
    }

    private Response errorRedirect(String code) {
        String errorUrl = LOGIN_PAGE + "?error=" + URLEncoder.encode(code, StandardCharsets.UTF_8);
        return Response.seeOther(URI.create(errorUrl)).build();
    }

    public record StatusResponse(boolean enabled, boolean configured) {}

    public record LogoutResponse(String logoutUrl) {}
}
