package io.nebula.identity.authentication;

import io.nebula.identity.account.EmailVerificationService;
import io.nebula.identity.session.SessionAuthority;
import io.nebula.identity.session.SessionContext;
import io.nebula.identity.session.SessionCookies;
import io.nebula.identity.session.WebSession;
import io.nebula.identity.user.User;
import io.nebula.identity.user.UserService;
import io.nebula.identity.user.UserView;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.*;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * Local account endpoints: registration, email/password login and logout.
 */
@Path("/auth")
@Tag(name = "Authentication", description = "Local account authentication endpoints")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

    private static final Logger LOG = Logger.getLogger(AuthResource.class);

    @Inject
    UserService userService;

    @Inject
    LocalAuthenticator localAuthenticator;

    @Inject
    SessionAuthority sessionAuthority;

    @Inject
    SessionContext sessionContext;

    @Inject
    SessionCookies sessionCookies;

    @Inject
    EmailVerificationService emailVerificationService;

    @Inject
    BaseUrlResolver baseUrlResolver;

    @Context
    UriInfo uriInfo;

    @Context
    HttpHeaders headers;

    /**
     * Create a local account and mail a verification link. Does not log the user in.
     * A failed verification mail does not fail the registration; the user can ask for a resend.
     */
    @POST
    @Path("/register")
    @Operation(summary = "Register a local account")
    @APIResponse(responseCode = "201", description = "Account created",
            content = @Content(schema = @Schema(implementation = UserView.class)))
    @APIResponse(responseCode = "400", description = "Invalid email, username or password")
    @APIResponse(responseCode = "409", description = "Email or username already registered")
    public Response register(@Valid RegisterRequest request) {
        User user = userService.register(
            request.email(),
            request.password(),
            request.username(),
            request.displayName()
        );

        try {
            emailVerificationService.sendVerification(user, baseUrlResolver.resolve(headers, uriInfo));
        } catch (AuthException e) {
            LOG.warnf("Verification mail for new user %s not sent: %s", user.id, e.failure().code());
        }

        return Response.status(Response.Status.CREATED)
                .entity(UserView.from(user))
                .build();
    }

    /**
     * Login with email and password.
     * Returns a session cookie on success.
     */
    @POST
    @Path("/login")
    @Operation(summary = "Login with email and password")
    @APIResponse(responseCode = "200", description = "Login successful",
            content = @Content(schema = @Schema(implementation = LoginResponse.class)))
    @APIResponse(responseCode = "401", description = "Invalid credentials")
    public Response login(@Valid LoginRequest request) {
        User user = localAuthenticator.authenticate(request.email(), request.password());
        WebSession session = sessionAuthority.establish(sessionContext.sessionId(), user.id);

        return Response.ok(new LoginResponse(UserView.from(user)))
                .cookie(sessionCookies.issue(session))
                .build();
    }

    /**
     * Logout. Deletes the server-side session and clears the cookie.
     */
    @POST
    @Path("/logout")
    @Operation(summary = "Logout and clear session")
    @APIResponse(responseCode = "200", description = "Logout successful")
    public Response logout() {
        String sessionId = sessionContext.sessionId();
        if (sessionId != null) {
            sessionAuthority.destroy(sessionId);
            LOG.debugf("Local logout completed");
        }

        return Response.ok(new MessageResponse("Logged out successfully"))
                .cookie(sessionCookies.expire())
                .build();
    }

    // DTOs

    public record RegisterRequest(
            @NotBlank @Email String email,
            @NotBlank @Size(max = 128) String password,
            @Size(max = 64) String username,
            @Size(max = 200) String displayName
    ) {}

    public record LoginRequest(@NotBlank String email, @NotBlank String password) {}

    public record LoginResponse(UserView user) {}

    public record MessageResponse(String message) {}
}
