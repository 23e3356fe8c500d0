package io.nebula.identity.admin;

import io.nebula.identity.authentication.AuthException;
import io.nebula.identity.authentication.AuthFailure;
import io.nebula.identity.authorization.AuthorizationGate;
import io.nebula.identity.authorization.RequiresRole;
import io.nebula.identity.session.SessionContext;
import io.nebula.identity.user.User;
import io.nebula.identity.user.UserRepository;
import io.nebula.identity.user.UserRole;
import io.nebula.identity.user.UserService;
import io.nebula.identity.user.UserView;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Admin API for the users of an organization.
 *
 * Company admins manage their own organization; global admins manage any.
 * Only a global admin may grant the global admin role.
 */
@Path("/api/admin")
@Tag(name = "User Admin", description = "Organization user management")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@RequiresRole(UserRole.COMPANY_ADMIN)
public class UserAdminResource {

    private static final Logger LOG = Logger.getLogger(UserAdminResource.class);

    @Inject
    UserRepository userRepository;

    @Inject
    UserService userService;

    @Inject
    SessionContext sessionContext;

    @Inject
    AuthorizationGate gate;

    @GET
    @Path("/organizations/{organizationId}/users")
    @Operation(summary = "List users of an organization")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Users of the organization"),
        @APIResponse(responseCode = "401", description = "Not authenticated"),
        @APIResponse(responseCode = "403", description = "Not an admin of this organization")
    })
    public UserListResponse listUsers(
            @PathParam("organizationId") @Parameter(description = "Organization ID") String organizationId) {
        gate.requireRoleInOrganization(sessionContext.currentUser(), UserRole.COMPANY_ADMIN, organizationId);

        List<UserView> users = userRepository.findByOrganizationId(organizationId).stream()
            .map(UserView::from)
            .toList();
        return new UserListResponse(users, users.size());
    }

    /**
     * Change a user's role. Applies on the user's next request.
     */
    @PATCH
    @Path("/users/{userId}/role")
    @Operation(summary = "Change a user's role")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Role changed",
            content = @Content(schema = @Schema(implementation = UserView.class))),
        @APIResponse(responseCode = "403", description = "Not allowed to manage this user or grant this role"),
        @APIResponse(responseCode = "404", description = "User not found")
    })
    public UserView changeRole(
            @PathParam("userId") @Parameter(description = "User ID") String userId,
            @Valid ChangeRoleRequest request) {
        User actor = gate.requireRole(sessionContext.currentUser(), UserRole.COMPANY_ADMIN);

        User target = userRepository.findByIdOptional(userId)
            .orElseThrow(() -> new NotFoundException("User not found: " + userId));
        gate.requireOrganizationAccess(actor, target.organizationId);

        boolean touchesGlobalAdmin = request.role() == UserRole.GLOBAL_ADMIN || target.isGlobalAdmin();
        if (touchesGlobalAdmin && !actor.isGlobalAdmin()) {
            throw new AuthException(AuthFailure.INSUFFICIENT_PERMISSIONS,
                "only global admins manage the global admin role");
        }

        User updated = userService.changeRole(userId, request.role());
        LOG.infof("User %s set role of %s to %s", actor.id, userId, request.role().code());
        return UserView.from(updated);
    }

    // DTOs

    public record ChangeRoleRequest(@NotNull UserRole role) {}

    public record UserListResponse(List<UserView> users, int total) {}
}
