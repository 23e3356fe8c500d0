package io.nebula.identity.authorization;

import io.nebula.identity.authentication.AuthException;
import io.nebula.identity.authentication.AuthFailure;
import io.nebula.identity.user.User;
import io.nebula.identity.user.UserRole;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * Role and tenant guards.
 *
 * <ul>
 *   <li>no user: AUTHENTICATION_REQUIRED (401)</li>
 *   <li>role below the threshold or outside the allow-set: INSUFFICIENT_PERMISSIONS (403)</li>
 *   <li>organization mismatch: INSUFFICIENT_PERMISSIONS, global admins exempt</li>
 * </ul>
 * Conditions compose by intersection.
 */
@ApplicationScoped
public class AuthorizationGate {

    public User requireAuthenticated(Optional<User> user) {
        return user.orElseThrow(() -> new AuthException(AuthFailure.AUTHENTICATION_REQUIRED));
    }

    public User requireRole(Optional<User> user, UserRole minimum) {
        return check(user, minimum, null);
    }

    public User requireAnyRole(Optional<User> user, Collection<UserRole> allowed) {
        return check(user, UserRole.lowest(), allowed);
    }

    /**
     * Authenticated, at least {@code minimum}, and in {@code anyOf} when that is non-empty.
     */
    public User check(Optional<User> user, UserRole minimum, Collection<UserRole> anyOf) {
        User actor = requireAuthenticated(user);

        if (minimum != null && !actor.role.isAtLeast(minimum)) {
            throw new AuthException(AuthFailure.INSUFFICIENT_PERMISSIONS,
                "role " + actor.role.code() + " below " + minimum.code());
        }
        if (anyOf != null && !anyOf.isEmpty() && !anyOf.contains(actor.role)) {
            throw new AuthException(AuthFailure.INSUFFICIENT_PERMISSIONS,
                "role " + actor.role.code() + " not in " + anyOf);
        }
        return actor;
    }

    /**
     * The acting user must belong to the organization, unless they are a global admin.
     */
    public void requireOrganizationAccess(User actor, String organizationId) {
        if (actor.isGlobalAdmin()) {
            return;
        }
        if (actor.organizationId == null || !Objects.equals(actor.organizationId, organizationId)) {
            throw new AuthException(AuthFailure.INSUFFICIENT_PERMISSIONS,
                "user " + actor.id + " outside organization " + organizationId);
        }
    }

    public User requireRoleInOrganization(Optional<User> user, UserRole minimum, String organizationId) {
        User actor = requireRole(user, minimum);
        requireOrganizationAccess(actor, organizationId);
        return actor;
    }
}
