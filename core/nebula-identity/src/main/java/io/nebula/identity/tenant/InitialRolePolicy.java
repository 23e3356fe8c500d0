package io.nebula.identity.tenant;

import io.nebula.identity.user.UserRole;

/**
 * Role given to a user created by JIT provisioning.
 *
 * <ul>
 *   <li>first user of a brand-new tenant: company admin</li>
 *   <li>existing tenant with no company admin: company admin (bootstrap recovery)</li>
 *   <li>otherwise: the lowest role</li>
 * </ul>
 *
 * Two first logins that both observe zero admins both become admins.
 */
public final class InitialRolePolicy {

    private InitialRolePolicy() {
    }

    public static UserRole computeInitialRole(boolean tenantIsNew, long existingAdminCount) {
        if (tenantIsNew || existingAdminCount <= 0) {
            return UserRole.COMPANY_ADMIN;
        }
        return UserRole.lowest();
    }
}
