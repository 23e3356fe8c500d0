package io.nebula.identity.organization;

import java.time.Instant;

/**
 * A tenant. Either a corporate organization matched by email domain and
 * directory tenant id, or a personal invite-only workspace for a user who
 * signed in with a public email address.
 *
 * <p>Slug is globally unique. Domain and federated tenant id are each unique when set.
 */
public class Organization {

    public String id;

    public String name;

    public String slug;

    /**
     * Verified email domain for corporate tenants. Null for personal tenants.
     */
    public String domain;

    /**
     * External directory tenant id (tid claim). Maps 1:1 to an organization.
     */
    public String federatedTenantId;

    /**
     * Invite-only organizations reject self-service JIT signups.
     */
    public boolean inviteOnly = false;

    public boolean ssoEnabled = false;

    public String ssoProvider;

    public Instant createdAt = Instant.now();

    public Instant updatedAt = Instant.now();

    public Organization() {
    }

    public boolean isPersonal() {
        return domain == null && slug != null && slug.startsWith(OrganizationSlugs.PERSONAL_PREFIX);
    }
}
