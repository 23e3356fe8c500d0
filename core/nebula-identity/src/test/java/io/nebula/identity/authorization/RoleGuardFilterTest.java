package io.nebula.identity.authorization;

import io.nebula.identity.session.SessionContext;
import io.nebula.identity.user.User;
import io.nebula.identity.user.UserRole;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RoleGuardFilter.
 */
class RoleGuardFilterTest {

    private ResourceInfo resourceInfo;
    private SessionContext sessionContext;
    private ContainerRequestContext requestContext;
    private RoleGuardFilter filter;

    @BeforeEach
    void setUp() {
        resourceInfo = mock(ResourceInfo.class);
        sessionContext = mock(SessionContext.class);
        requestContext = mock(ContainerRequestContext.class, RETURNS_DEEP_STUBS);
        when(requestContext.getUriInfo().getPath()).thenReturn("/api/test");

        filter = new RoleGuardFilter();
        filter.resourceInfo = resourceInfo;
        filter.sessionContext = sessionContext;
        filter.gate = new AuthorizationGate();
    }

    @Test
    @DisplayName("anonymous request to a guarded method should be aborted with 401")
    void filter_shouldAbortWith401_whenAnonymous() throws Exception {
        // Arrange
        target("adminOnly");
        when(sessionContext.currentUser()).thenReturn(Optional.empty());

        // Act
        filter.filter(requestContext);

        // Assert
        assertThat(abortedStatus()).isEqualTo(401);
    }

    @Test
    @DisplayName("user below the method threshold should be aborted with 403")
    void filter_shouldAbortWith403_whenRoleTooLow() throws Exception {
        target("adminOnly");
        when(sessionContext.currentUser()).thenReturn(Optional.of(user(UserRole.FACILITATOR)));

        filter.filter(requestContext);

        assertThat(abortedStatus()).isEqualTo(403);
    }

    @Test
    @DisplayName("user meeting the threshold should pass through")
    void filter_shouldPass_whenRoleSufficient() throws Exception {
        target("adminOnly");
        when(sessionContext.currentUser()).thenReturn(Optional.of(user(UserRole.COMPANY_ADMIN)));

        filter.filter(requestContext);

        verify(requestContext, never()).abortWith(any());
    }

    @Test
    @DisplayName("allow-set on the method should exclude roles outside it")
    void filter_shouldApplyAllowSet_whenAnyOfGiven() throws Exception {
        target("facilitatorsOnly");
        when(sessionContext.currentUser()).thenReturn(Optional.of(user(UserRole.COMPANY_ADMIN)));

        filter.filter(requestContext);

        assertThat(abortedStatus()).isEqualTo(403);
    }

    @Test
    @DisplayName("class-level annotation should apply when the method has none")
    void filter_shouldUseClassAnnotation_whenMethodUnannotated() throws Exception {
        target("inherited");
        when(sessionContext.currentUser()).thenReturn(Optional.of(user(UserRole.USER)));

        filter.filter(requestContext);

        verify(requestContext, never()).abortWith(any());
    }

    private void target(String methodName) throws NoSuchMethodException {
        when(resourceInfo.getResourceMethod()).thenReturn(GuardedResource.class.getMethod(methodName));
        doReturn(GuardedResource.class).when(resourceInfo).getResourceClass();
    }

    private int abortedStatus() {
        ArgumentCaptor<Response> response = ArgumentCaptor.forClass(Response.class);
        verify(requestContext).abortWith(response.capture());
        return response.getValue().getStatus();
    }

    private static User user(UserRole role) {
        User user = new User();
        user.id = "usr_" + role.code();
        user.role = role;
        return user;
    }

    @RequiresRole
    public static class GuardedResource {

        @RequiresRole(UserRole.COMPANY_ADMIN)
        public void adminOnly() {
        }

        @RequiresRole(anyOf = {UserRole.FACILITATOR})
        public void facilitatorsOnly() {
        }

        public void inherited() {
        }
    }
}
