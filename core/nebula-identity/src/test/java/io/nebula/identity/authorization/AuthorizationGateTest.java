package io.nebula.identity.authorization;

import io.nebula.identity.authentication.AuthException;
import io.nebula.identity.authentication.AuthFailure;
import io.nebula.identity.user.User;
import io.nebula.identity.user.UserRole;
import org.assertj.core.api.ThrowableAssert;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AuthorizationGate.
 */
class AuthorizationGateTest {

    private final AuthorizationGate gate = new AuthorizationGate();

    // ========================================
    // AUTHENTICATION
    // ========================================

    @Test
    @DisplayName("missing user should fail with AUTHENTICATION_REQUIRED")
    void requireAuthenticated_shouldFail_whenNoUser() {
        assertFailure(() -> gate.requireAuthenticated(Optional.empty()), AuthFailure.AUTHENTICATION_REQUIRED);
        assertFailure(() -> gate.requireRole(Optional.empty(), UserRole.USER), AuthFailure.AUTHENTICATION_REQUIRED);
    }

    // ========================================
    // ROLE THRESHOLD
    // ========================================

    @Test
    @DisplayName("requireRole should follow the role order")
    void requireRole_shouldRespectHierarchy() {
        Optional<User> facilitator = Optional.of(user(UserRole.FACILITATOR, "org_1"));

        assertThat(gate.requireRole(facilitator, UserRole.USER)).isNotNull();
        assertThat(gate.requireRole(facilitator, UserRole.FACILITATOR)).isNotNull();
        assertFailure(() -> gate.requireRole(facilitator, UserRole.COMPANY_ADMIN), AuthFailure.INSUFFICIENT_PERMISSIONS);
    }

    @Test
    @DisplayName("global admin should pass every threshold")
    void requireRole_shouldPassGlobalAdmin_forAnyThreshold() {
        Optional<User> admin = Optional.of(user(UserRole.GLOBAL_ADMIN, null));

        for (UserRole role : UserRole.values()) {
            assertThat(gate.requireRole(admin, role)).isNotNull();
        }
    }

    // ========================================
    // ALLOW-SET
    // ========================================

    @Test
    @DisplayName("requireAnyRole should accept only listed roles")
    void requireAnyRole_shouldMatchExplicitSet() {
        List<UserRole> allowed = List.of(UserRole.FACILITATOR, UserRole.COMPANY_ADMIN);

        assertThat(gate.requireAnyRole(Optional.of(user(UserRole.FACILITATOR, "org_1")), allowed)).isNotNull();
        assertFailure(() -> gate.requireAnyRole(Optional.of(user(UserRole.USER, "org_1")), allowed),
            AuthFailure.INSUFFICIENT_PERMISSIONS);
        assertFailure(() -> gate.requireAnyRole(Optional.of(user(UserRole.GLOBAL_ADMIN, null)), allowed),
            AuthFailure.INSUFFICIENT_PERMISSIONS);
    }

    @Test
    @DisplayName("check should require both the threshold and the allow-set")
    void check_shouldIntersectConditions() {
        Optional<User> facilitator = Optional.of(user(UserRole.FACILITATOR, "org_1"));

        assertFailure(() -> gate.check(facilitator, UserRole.COMPANY_ADMIN, List.of(UserRole.FACILITATOR)),
            AuthFailure.INSUFFICIENT_PERMISSIONS);
        assertThat(gate.check(facilitator, UserRole.USER, List.of(UserRole.FACILITATOR))).isNotNull();
        assertThat(gate.check(facilitator, UserRole.USER, List.of())).isNotNull();
    }

    // ========================================
    // ORGANIZATION SCOPE
    // ========================================

    @Test
    @DisplayName("company admin should be limited to their own organization")
    void requireOrganizationAccess_shouldRejectOtherOrganization() {
        User admin = user(UserRole.COMPANY_ADMIN, "org_1");

        assertThatCode(() -> gate.requireOrganizationAccess(admin, "org_1")).doesNotThrowAnyException();
        assertFailure(() -> gate.requireOrganizationAccess(admin, "org_2"), AuthFailure.INSUFFICIENT_PERMISSIONS);
        assertFailure(() -> gate.requireOrganizationAccess(user(UserRole.COMPANY_ADMIN, null), "org_1"),
            AuthFailure.INSUFFICIENT_PERMISSIONS);
    }

    @Test
    @DisplayName("global admin should be exempt from the organization check")
    void requireOrganizationAccess_shouldExemptGlobalAdmin() {
        assertThatCode(() -> gate.requireOrganizationAccess(user(UserRole.GLOBAL_ADMIN, null), "org_2"))
            .doesNotThrowAnyException();
    }

    private static void assertFailure(ThrowableAssert.ThrowingCallable call, AuthFailure expected) {
        assertThatThrownBy(call)
            .isInstanceOfSatisfying(AuthException.class, e -> assertThat(e.failure()).isEqualTo(expected));
    }

    private static User user(UserRole role, String organizationId) {
        User user = new User();
        user.id = "usr_" + role.code();
        user.role = role;
        user.organizationId = organizationId;
        return user;
    }
}
