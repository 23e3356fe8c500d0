package io.nebula.identity.user;

import java.time.Instant;

/**
 * Public representation of a user. Never carries the password hash.
 */
public record UserView(
    String id,
    String email,
    String username,
    String displayName,
    UserRole role,
    String organizationId,
    AuthProvider authProvider,
    boolean emailVerified,
    Instant lastLoginAt,
    Instant createdAt
) {

    public static UserView from(User user) {
        return new UserView(
            user.id,
            user.email,
            user.username,
            user.displayName,
            user.role,
            user.organizationId,
            user.authProvider,
            user.emailVerified,
            user.lastLoginAt,
            user.createdAt
        );
    }
}
