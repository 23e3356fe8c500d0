package io.nebula.identity.user;

import java.time.Instant;
import java.util.Locale;

/**
 * A human user of the platform.
 *
 * <p>Unique on normalized email, and on {@link #federatedSubjectId} when it is set.
 * SSO-only accounts carry no password hash. Users are never deleted here.
 */
public class User {

    public String id;

    public String email;

    public String username;

    public String passwordHash;

    public String displayName;

    public UserRole role = UserRole.USER;

    /**
     * Home organization. Null for global admins and for freshly registered local users.
     */
    public String organizationId;

    /**
     * Stable subject id issued by the identity provider (oid/sub claim).
     */
    public String federatedSubjectId;

    /**
     * Directory tenant id issued by the identity provider (tid claim).
     */
    public String federatedTenantId;

    public AuthProvider authProvider = AuthProvider.LOCAL;

    public boolean emailVerified = false;

    public Instant lastLoginAt;

    public Instant createdAt = Instant.now();

    public Instant updatedAt = Instant.now();

    public User() {
    }

    public boolean hasPassword() {
        return passwordHash != null && !passwordHash.isEmpty();
    }

    public boolean isGlobalAdmin() {
        return role == UserRole.GLOBAL_ADMIN;
    }

    /**
     * Normalize an email address: trimmed and lower-cased.
     *
     * @return the normalized email, or null if the input is null or blank
     */
    public static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            return null;
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Extract the domain part of an email address.
     *
     * @throws IllegalArgumentException if the address has no domain part
     */
    public static String emailDomain(String email) {
        int atIndex = email == null ? -1 : email.lastIndexOf('@');
        if (atIndex < 0 || atIndex == email.length() - 1) {
            throw new IllegalArgumentException("Invalid email format: " + email);
        }
        return email.substring(atIndex + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Extract the local part of an email address (before the @).
     */
    public static String emailLocalPart(String email) {
        int atIndex = email == null ? -1 : email.indexOf('@');
        return atIndex < 0 ? email : email.substring(0, atIndex);
    }
}
