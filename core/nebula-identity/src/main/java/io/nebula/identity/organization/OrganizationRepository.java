package io.nebula.identity.organization;

import java.util.Optional;

/**
 * Repository interface for Organization entities.
 */
public interface OrganizationRepository {

    // Read operations
    Optional<Organization> findByIdOptional(String id);
    Optional<Organization> findByFederatedTenantId(String federatedTenantId);
    Optional<Organization> findByDomain(String domain);
    Optional<Organization> findBySlug(String slug);

    // Write operations

    /**
     * Insert a new organization in its own transaction.
     *
     * @throws DuplicateOrganizationException if slug, domain or federated tenant id is already taken
     */
    void insert(Organization organization);

    void update(Organization organization);
}
