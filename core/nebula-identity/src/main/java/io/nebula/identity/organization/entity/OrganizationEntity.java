package io.nebula.identity.organization.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;

/**
 * JPA entity for organizations table.
 *
 * The unique constraints are the only mutual exclusion between concurrent
 * first logins from the same tenant.
 */
@Entity
@Table(name = "organizations",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_organizations_slug", columnNames = "slug"),
        @UniqueConstraint(name = "uk_organizations_domain", columnNames = "domain"),
        @UniqueConstraint(name = "uk_organizations_federated_tenant_id", columnNames = "federated_tenant_id")
    })
public class OrganizationEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "name", nullable = false, length = 255)
    public String name;

    @Column(name = "slug", nullable = false, length = 64)
    public String slug;

    @Column(name = "domain", length = 255)
    public String domain;

    @Column(name = "federated_tenant_id", length = 255)
    public String federatedTenantId;

    @Column(name = "invite_only", nullable = false)
    public boolean inviteOnly;

    @Column(name = "sso_enabled", nullable = false)
    public boolean ssoEnabled;

    @Column(name = "sso_provider", length = 20)
    public String ssoProvider;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public OrganizationEntity() {
    }
}
