package io.nebula.identity.testing;

import io.nebula.identity.organization.DuplicateOrganizationException;
import io.nebula.identity.organization.Organization;
import io.nebula.identity.organization.OrganizationRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;

/**
 * In-memory OrganizationRepository with the unique constraints of the organizations table.
 *
 * <p>{@link #holdInsertsAt(CyclicBarrier)} makes the next inserts wait at the barrier until it
 * trips once, so concurrent callers are guaranteed to have finished their lookups before any
 * insert lands. Later inserts (retries after a conflict) go through without waiting.
 */
public class InMemoryOrganizationRepository implements OrganizationRepository {

    private final Map<String, Organization> organizations = new ConcurrentHashMap<>();
    private volatile CyclicBarrier insertBarrier;

    public void holdInsertsAt(CyclicBarrier barrier) {
        this.insertBarrier = barrier;
    }

    public void add(Organization organization) {
        organizations.put(organization.id, organization);
    }

    @Override
    public Optional<Organization> findByIdOptional(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(organizations.get(id));
    }

    @Override
    public Optional<Organization> findByFederatedTenantId(String federatedTenantId) {
        return organizations.values().stream()
            .filter(o -> o.federatedTenantId != null && o.federatedTenantId.equals(federatedTenantId))
            .findFirst();
    }

    @Override
    public Optional<Organization> findByDomain(String domain) {
        return organizations.values().stream()
            .filter(o -> o.domain != null && o.domain.equals(domain))
            .findFirst();
    }

    @Override
    public Optional<Organization> findBySlug(String slug) {
        return organizations.values().stream()
            .filter(o -> Objects.equals(o.slug, slug))
            .findFirst();
    }

    @Override
    public void insert(Organization organization) {
        CyclicBarrier barrier = insertBarrier;
        if (barrier != null) {
            try {
                barrier.await(5, TimeUnit.SECONDS);
                insertBarrier = null;
            } catch (Exception e) {
                throw new IllegalStateException("insert barrier broken", e);
            }
        }

        synchronized (this) {
            boolean clash = findBySlug(organization.slug).isPresent()
                || (organization.domain != null && findByDomain(organization.domain).isPresent())
                || (organization.federatedTenantId != null
                    && findByFederatedTenantId(organization.federatedTenantId).isPresent());
            if (clash) {
                throw new DuplicateOrganizationException("Organization already exists: " + organization.slug);
            }
            organizations.put(organization.id, organization);
        }
    }

    @Override
    public void update(Organization organization) {
        organizations.put(organization.id, organization);
    }

    public List<Organization> all() {
        return new ArrayList<>(organizations.values());
    }
}
