package io.nebula.identity.tenant;

import io.nebula.identity.organization.Organization;

/**
 * Outcome of resolving a tenant for a federated login.
 *
 * <p>Losing a creation race is not an error: the loser gets {@link FoundExisting}
 * holding the organization the winner created.
 */
public sealed interface TenantResolution permits TenantResolution.Created, TenantResolution.FoundExisting {

    Organization organization();

    boolean isNew();

    /**
     * This call created the organization.
     */
    record Created(Organization organization) implements TenantResolution {
        @Override
        public boolean isNew() {
            return true;
        }
    }

    /**
     * The organization already existed, or a concurrent request created it first.
     */
    record FoundExisting(Organization organization) implements TenantResolution {
        @Override
        public boolean isNew() {
            return false;
        }
    }
}
