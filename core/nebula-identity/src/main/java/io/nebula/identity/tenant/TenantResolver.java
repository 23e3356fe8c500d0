package io.nebula.identity.tenant;

import io.nebula.identity.authentication.AuthException;
import io.nebula.identity.authentication.AuthFailure;
import io.nebula.identity.authentication.oidc.FederatedIdentity;
import io.nebula.identity.organization.DuplicateOrganizationException;
import io.nebula.identity.organization.Organization;
import io.nebula.identity.organization.OrganizationRepository;
import io.nebula.identity.organization.OrganizationSlugs;
import io.nebula.identity.organization.PublicEmailDomains;
import io.nebula.identity.shared.EntityType;
import io.nebula.identity.shared.TsidGenerator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * Maps a federated identity to a local organization, creating it on first sight.
 *
 * <p>Corporate email domains resolve by directory tenant id, then by domain, then
 * by creating an organization named after the domain. Public webmail domains
 * resolve to a personal invite-only workspace keyed by a slug derived from the
 * subject id.
 *
 * <p>Concurrent first logins are serialized by the database unique constraints only.
 * The loser of an insert race re-reads once and proceeds with the winner's row.
 */
@ApplicationScoped
public class TenantResolver {

    private static final Logger LOG = Logger.getLogger(TenantResolver.class);

    static final String SSO_PROVIDER = "oidc";
    static final int MAX_SLUG_ATTEMPTS = 20;

    @Inject
    OrganizationRepository organizationRepository;

    @Inject
    PublicEmailDomains publicEmailDomains;

    /**
     * Resolve or create the organization for a federated identity.
     *
     * @throws AuthException INVITATION_REQUIRED when an existing organization is invite-only,
     *                       SSO_DISABLED_FOR_TENANT when it has SSO turned off,
     *                       PROVISIONING_CONFLICT when an insert race cannot be resolved by one re-fetch
     */
    public TenantResolution resolveOrCreateOrganization(FederatedIdentity identity) {
        String domain = identity.emailDomain();

        TenantResolution resolution = publicEmailDomains.isPublic(domain)
            ? resolvePersonal(identity)
            : resolveCorporate(identity, domain);

        if (!resolution.isNew()) {
            requireSsoEnabled(resolution.organization());
        }
        return resolution;
    }

    // ==================== Corporate tenants ====================

    private TenantResolution resolveCorporate(FederatedIdentity identity, String domain) {
        String tenantId = identity.tenantId();

        if (tenantId != null) {
            Optional<Organization> byTenant = organizationRepository.findByFederatedTenantId(tenantId);
            if (byTenant.isPresent()) {
                return new TenantResolution.FoundExisting(requireOpen(byTenant.get()));
            }
        }

        Optional<Organization> byDomain = organizationRepository.findByDomain(domain);
        if (byDomain.isPresent()) {
            Organization organization = requireOpen(byDomain.get());
            requireSsoEnabled(organization);
            adoptFederation(organization, tenantId);
            return new TenantResolution.FoundExisting(organization);
        }

        return createCorporate(tenantId, domain);
    }

    private TenantResolution createCorporate(String tenantId, String domain) {
        Organization organization = new Organization();
        organization.id = TsidGenerator.generate(EntityType.ORGANIZATION);
        organization.name = OrganizationSlugs.nameFromDomain(domain);
        organization.domain = domain;
        organization.federatedTenantId = tenantId;
        organization.inviteOnly = false;
        organization.ssoEnabled = true;
        organization.ssoProvider = SSO_PROVIDER;

        String baseSlug = OrganizationSlugs.slugify(organization.name);
        for (int attempt = 0; attempt < MAX_SLUG_ATTEMPTS; attempt++) {
            String slug = OrganizationSlugs.candidate(baseSlug, attempt);
            if (organizationRepository.findBySlug(slug).isPresent()) {
                continue;
            }
            organization.slug = slug;

            try {
                organizationRepository.insert(organization);
                LOG.infof("Created organization %s (%s) for domain %s", organization.id, slug, domain);
                return new TenantResolution.Created(organization);
            } catch (DuplicateOrganizationException e) {
                Optional<Organization> winner = refetchCorporate(tenantId, domain);
                if (winner.isPresent()) {
                    LOG.infof("Concurrent login created organization %s first, reusing it", winner.get().id);
                    return new TenantResolution.FoundExisting(requireOpen(winner.get()));
                }
                if (organizationRepository.findBySlug(slug).isPresent()) {
                    // Another organization claimed the slug in the meantime
                    LOG.debugf("Slug %s taken concurrently, trying the next candidate", slug);
                    continue;
                }
                throw new AuthException(AuthFailure.PROVISIONING_CONFLICT,
                    "insert conflict for domain " + domain + " but no organization on re-fetch", e);
            }
        }

        throw new AuthException(AuthFailure.PROVISIONING_CONFLICT, "no free slug for " + baseSlug);
    }

    private Optional<Organization> refetchCorporate(String tenantId, String domain) {
        if (tenantId != null) {
            Optional<Organization> byTenant = organizationRepository.findByFederatedTenantId(tenantId);
            if (byTenant.isPresent()) {
                return byTenant;
            }
        }
        return organizationRepository.findByDomain(domain);
    }

    /**
     * Attach federation metadata to a domain-matched organization that has none yet.
     * Callers have already refused organizations with SSO turned off.
     */
    private void adoptFederation(Organization organization, String tenantId) {
        if (tenantId == null || organization.federatedTenantId != null) {
            return;
        }
        organization.federatedTenantId = tenantId;
        organization.ssoProvider = SSO_PROVIDER;
        organizationRepository.update(organization);
        LOG.infof("Organization %s adopted federated sign-on", organization.id);
    }

    private void requireSsoEnabled(Organization organization) {
        if (!organization.ssoEnabled) {
            LOG.infof("Federated login refused: SSO disabled for organization %s", organization.id);
            throw new AuthException(AuthFailure.SSO_DISABLED_FOR_TENANT, "organization " + organization.id);
        }
    }

    private Organization requireOpen(Organization organization) {
        if (organization.inviteOnly) {
            LOG.infof("Federated signup refused: organization %s is invite-only", organization.id);
            throw new AuthException(AuthFailure.INVITATION_REQUIRED, "organization " + organization.id);
        }
        return organization;
    }

    // ==================== Personal tenants ====================

    private TenantResolution resolvePersonal(FederatedIdentity identity) {
        String slug = OrganizationSlugs.personalSlug(identity.subjectId());

        Optional<Organization> existing = organizationRepository.findBySlug(slug);
        if (existing.isPresent()) {
            return new TenantResolution.FoundExisting(existing.get());
        }

        Organization organization = new Organization();
        organization.id = TsidGenerator.generate(EntityType.ORGANIZATION);
        organization.name = OrganizationSlugs.personalName(identity.displayName());
        organization.slug = slug;
        organization.domain = null;
        organization.federatedTenantId = null;
        organization.inviteOnly = true;
        organization.ssoEnabled = true;
        organization.ssoProvider = SSO_PROVIDER;

        try {
            organizationRepository.insert(organization);
            LOG.infof("Created personal workspace %s (%s)", organization.id, slug);
            return new TenantResolution.Created(organization);
        } catch (DuplicateOrganizationException e) {
            Organization winner = organizationRepository.findBySlug(slug)
                .orElseThrow(() -> new AuthException(AuthFailure.PROVISIONING_CONFLICT,
                    "insert conflict for " + slug + " but no organization on re-fetch", e));
            return new TenantResolution.FoundExisting(winner);
        }
    }
}
