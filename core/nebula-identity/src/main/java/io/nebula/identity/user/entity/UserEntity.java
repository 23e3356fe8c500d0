package io.nebula.identity.user.entity;

import io.nebula.identity.user.AuthProvider;
import io.nebula.identity.user.UserRole;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;

/**
 * JPA entity for users table.
 */
@Entity
@Table(name = "users",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_users_email", columnNames = "email"),
        @UniqueConstraint(name = "uk_users_username", columnNames = "username"),
        @UniqueConstraint(name = "uk_users_federated_subject_id", columnNames = "federated_subject_id")
    },
    indexes = {
        @Index(name = "idx_users_organization_role", columnList = "organization_id, role")
    })
public class UserEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "email", nullable = false, length = 320)
    public String email;

    @Column(name = "username", nullable = false, length = 64)
    public String username;

    @Column(name = "password_hash", length = 255)
    public String passwordHash;

    @Column(name = "display_name", length = 255)
    public String displayName;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    public UserRole role;

    @Column(name = "organization_id", length = 17)
    public String organizationId;

    @Column(name = "federated_subject_id", length = 255)
    public String federatedSubjectId;

    @Column(name = "federated_tenant_id", length = 255)
    public String federatedTenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "auth_provider", nullable = false, length = 10)
    public AuthProvider authProvider;

    @Column(name = "email_verified", nullable = false)
    public boolean emailVerified;

    @Column(name = "last_login_at")
    public Instant lastLoginAt;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public UserEntity() {
    }
}
