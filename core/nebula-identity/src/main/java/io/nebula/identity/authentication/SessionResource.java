package io.nebula.identity.authentication;

import io.nebula.identity.authorization.AuthorizationGate;
import io.nebula.identity.session.SessionContext;
import io.nebula.identity.user.User;
import io.nebula.identity.user.UserView;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Session endpoints, independent of how the user authenticated.
 */
@Path("/auth")
@Tag(name = "Session", description = "Session endpoints")
@Produces(MediaType.APPLICATION_JSON)
public class SessionResource {

    @Inject
    SessionContext sessionContext;

    @Inject
    AuthorizationGate gate;

    /**
     * Current user, read fresh from the store.
     */
    @GET
    @Path("/me")
    @Operation(summary = "Get current authenticated user")
    @APIResponse(responseCode = "200", description = "User info",
            content = @Content(schema = @Schema(implementation = UserView.class)))
    @APIResponse(responseCode = "401", description = "Not authenticated")
    public UserView me() {
        User user = gate.requireAuthenticated(sessionContext.currentUser());
        return UserView.from(user);
    }
}
