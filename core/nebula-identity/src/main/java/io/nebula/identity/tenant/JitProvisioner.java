package io.nebula.identity.tenant;

import io.nebula.identity.authentication.AuthException;
import io.nebula.identity.authentication.AuthFailure;
import io.nebula.identity.authentication.oidc.FederatedIdentity;
import io.nebula.identity.organization.Organization;
import io.nebula.identity.organization.OrganizationRepository;
import io.nebula.identity.shared.EntityType;
import io.nebula.identity.shared.TsidGenerator;
import io.nebula.identity.user.AuthProvider;
import io.nebula.identity.user.User;
import io.nebula.identity.user.UserRepository;
import io.nebula.identity.user.UserRole;
import io.nebula.identity.user.UserService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Optional;

/**
 * Finds, links or creates the local user for a federated identity.
 *
 * Lookup order:
 * <ol>
 *   <li>by federated subject id (a prior federated login)</li>
 *   <li>by email (a local account, which gets linked without a role change), only when
 *       the provider marks the email as verified</li>
 *   <li>create, after resolving the tenant, with the role from {@link InitialRolePolicy}</li>
 * </ol>
 */
@ApplicationScoped
public class JitProvisioner {

    private static final Logger LOG = Logger.getLogger(JitProvisioner.class);

    @Inject
    UserRepository userRepository;

    @Inject
    OrganizationRepository organizationRepository;

    @Inject
    TenantResolver tenantResolver;

    @Inject
    UserService userService;

    @Transactional
    public User provision(FederatedIdentity identity) {
        Optional<User> bySubject = userRepository.findByFederatedSubjectId(identity.subjectId());
        if (bySubject.isPresent()) {
            User user = bySubject.get();
            requireSsoAllowed(user);
            user.lastLoginAt = Instant.now();
            userRepository.update(user);
            LOG.debugf("Federated login for existing user %s", user.id);
            return user;
        }

        Optional<User> byEmail = userRepository.findByEmail(identity.email());
        if (byEmail.isPresent()) {
            User user = byEmail.get();
            if (!identity.emailVerified()) {
                LOG.warnf("Refused to link account %s: provider did not verify the email", user.id);
                throw new AuthException(AuthFailure.SECURITY_VALIDATION_FAILED,
                    "unverified email matches existing account " + user.id);
            }
            requireSsoAllowed(user);
            link(user, identity);
            userRepository.update(user);
            LOG.infof("Linked existing account %s to federated subject", user.id);
            return user;
        }

        return create(identity);
    }

    private User create(FederatedIdentity identity) {
        TenantResolution resolution = tenantResolver.resolveOrCreateOrganization(identity);
        Organization organization = resolution.organization();

        long existingAdmins = resolution.isNew()
            ? 0
            : userRepository.countByOrganizationIdAndRole(organization.id, UserRole.COMPANY_ADMIN);
        UserRole role = InitialRolePolicy.computeInitialRole(resolution.isNew(), existingAdmins);

        User user = new User();
        user.id = TsidGenerator.generate(EntityType.USER);
        user.email = identity.email();
        user.username = userService.generateUniqueUsername(identity.email());
        user.passwordHash = null;
        user.displayName = identity.displayName();
        user.role = role;
        user.organizationId = organization.id;
        user.federatedSubjectId = identity.subjectId();
        user.federatedTenantId = identity.tenantId();
        user.authProvider = AuthProvider.OIDC;
        user.emailVerified = identity.emailVerified();
        user.lastLoginAt = Instant.now();

        userRepository.persist(user);
        LOG.infof("Provisioned user %s in organization %s with role %s (tenant new: %s)",
            user.id, organization.id, role.code(), resolution.isNew());
        return user;
    }

    /**
     * Attach federated ids to a pre-existing account. The provider vouches for the email.
     */
    private void link(User user, FederatedIdentity identity) {
        user.federatedSubjectId = identity.subjectId();
        user.federatedTenantId = identity.tenantId();
        user.authProvider = AuthProvider.OIDC;
        user.emailVerified = true;
        user.lastLoginAt = Instant.now();
    }

    private void requireSsoAllowed(User user) {
        if (user.organizationId == null) {
            return;
        }
        organizationRepository.findByIdOptional(user.organizationId)
            .filter(organization -> !organization.ssoEnabled)
            .ifPresent(organization -> {
                LOG.infof("Federated login refused for user %s: SSO disabled for organization %s",
                    user.id, organization.id);
                throw new AuthException(AuthFailure.SSO_DISABLED_FOR_TENANT, "organization " + organization.id);
            });
    }
}
