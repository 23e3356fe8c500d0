package io.nebula.identity.organization.panache;

import io.nebula.identity.organization.Organization;
import io.nebula.identity.organization.OrganizationRepository;
import io.nebula.identity.organization.entity.OrganizationEntity;
import io.nebula.identity.organization.mapper.OrganizationMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;

import java.util.Optional;

/**
 * Read-side repository for Organization entities.
 * Uses EntityManager directly to return domain objects without conflicts.
 */
@ApplicationScoped
public class OrganizationReadRepository implements OrganizationRepository {

    @Inject
    EntityManager em;

    @Inject
    OrganizationWriteRepository writeRepo;

    @Override
    public Optional<Organization> findByIdOptional(String id) {
        if (id == null) {
            return Optional.empty();
        }
        OrganizationEntity entity = em.find(OrganizationEntity.class, id);
        return Optional.ofNullable(entity).map(OrganizationMapper::toDomain);
    }

    @Override
    public Optional<Organization> findByFederatedTenantId(String federatedTenantId) {
        return findSingle("FROM OrganizationEntity WHERE federatedTenantId = :value", federatedTenantId);
    }

    @Override
    public Optional<Organization> findByDomain(String domain) {
        return findSingle("FROM OrganizationEntity WHERE domain = :value", domain);
    }

    @Override
    public Optional<Organization> findBySlug(String slug) {
        return findSingle("FROM OrganizationEntity WHERE slug = :value", slug);
    }

    private Optional<Organization> findSingle(String query, String value) {
        if (value == null) {
            return Optional.empty();
        }
        var results = em.createQuery(query, OrganizationEntity.class)
            .setParameter("value", value)
            .setMaxResults(1)
            .getResultList();
        return results.isEmpty() ? Optional.empty() : Optional.of(OrganizationMapper.toDomain(results.get(0)));
    }

    // Write operations delegate to WriteRepository
    @Override
    public void insert(Organization organization) {
        writeRepo.insertOrganization(organization);
    }

    @Override
    public void update(Organization organization) {
        writeRepo.updateOrganization(organization);
    }
}
