package io.nebula.identity.tenant;

import io.nebula.identity.user.UserRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class InitialRolePolicyTest {

    @Test
    @DisplayName("first user of a new tenant should become company admin")
    void computeInitialRole_shouldReturnCompanyAdmin_whenTenantIsNew() {
        assertThat(InitialRolePolicy.computeInitialRole(true, 0)).isEqualTo(UserRole.COMPANY_ADMIN);
    }

    @Test
    @DisplayName("existing tenant without admins should get one")
    void computeInitialRole_shouldReturnCompanyAdmin_whenNoAdminsExist() {
        assertThat(InitialRolePolicy.computeInitialRole(false, 0)).isEqualTo(UserRole.COMPANY_ADMIN);
    }

    @Test
    @DisplayName("existing tenant with an admin should give the lowest role")
    void computeInitialRole_shouldReturnLowestRole_whenAdminExists() {
        assertThat(InitialRolePolicy.computeInitialRole(false, 1)).isEqualTo(UserRole.USER);
        assertThat(InitialRolePolicy.computeInitialRole(false, 3)).isEqualTo(UserRole.lowest());
    }
}
