package io.nebula.identity.organization.panache;

import io.nebula.identity.organization.DuplicateOrganizationException;
import io.nebula.identity.organization.Organization;
import io.nebula.identity.organization.entity.OrganizationEntity;
import io.nebula.identity.organization.mapper.OrganizationMapper;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;
import org.hibernate.exception.ConstraintViolationException;
import org.jboss.logging.Logger;

import java.time.Instant;

/**
 * Write-side repository for Organization entities.
 * Extends PanacheRepositoryBase for efficient entity persistence.
 */
@ApplicationScoped
public class OrganizationWriteRepository implements PanacheRepositoryBase<OrganizationEntity, String> {

    private static final Logger LOG = Logger.getLogger(OrganizationWriteRepository.class);

    /**
     * Insert a new organization and flush immediately, in a transaction of its own.
     *
     * <p>A uniqueness violation rolls back only this transaction, so the caller's
     * transaction stays usable for re-reading the row the other writer committed.
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public void insertOrganization(Organization organization) {
        if (organization.createdAt == null) {
            organization.createdAt = Instant.now();
        }
        organization.updatedAt = Instant.now();

        try {
            persist(OrganizationMapper.toEntity(organization));
            flush();
        } catch (PersistenceException e) {
            if (isConstraintViolation(e)) {
                LOG.infof("Organization insert lost a uniqueness race (slug=%s, domain=%s, tenant=%s)",
                    organization.slug, organization.domain, organization.federatedTenantId);
                throw new DuplicateOrganizationException(
                    "Organization already exists: " + organization.slug, e);
            }
            throw e;
        }
    }

    /**
     * Update an existing organization.
     */
    @Transactional
    public void updateOrganization(Organization organization) {
        organization.updatedAt = Instant.now();
        OrganizationEntity entity = findById(organization.id);
        if (entity != null) {
            OrganizationMapper.updateEntity(entity, organization);
        }
    }

    private static boolean isConstraintViolation(PersistenceException e) {
        return e instanceof ConstraintViolationException
            || e.getCause() instanceof ConstraintViolationException;
    }
}
