package io.nebula.identity.authentication.oidc;

import io.nebula.identity.user.User;

import java.util.Objects;

/**
 * Validated claim set extracted from an ID token. Exists only for the duration
 * of one callback.
 *
 * @param subjectId     stable provider-issued user id (never null)
 * @param tenantId      provider directory tenant id, null for personal accounts
 * @param email         normalized email (never null)
 * @param displayName   display name, defaulted to the email local part
 * @param emailVerified whether the provider vouches for the email
 */
public record FederatedIdentity(
    String subjectId,
    String tenantId,
    String email,
    String displayName,
    boolean emailVerified
) {

    public FederatedIdentity {
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(email, "email");
        email = User.normalizeEmail(email);
        if (displayName == null || displayName.isBlank()) {
            displayName = User.emailLocalPart(email);
        }
    }

    public String emailDomain() {
        return User.emailDomain(email);
    }
}
