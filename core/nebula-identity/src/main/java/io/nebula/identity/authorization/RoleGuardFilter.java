package io.nebula.identity.authorization;

import io.nebula.identity.authentication.AuthException;
import io.nebula.identity.authentication.AuthExceptionMapper;
import io.nebula.identity.session.SessionContext;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.lang.reflect.Method;
import java.util.Arrays;

/**
 * JAX-RS filter enforcing {@link RequiresRole} on annotated resources.
 * Runs after {@link io.nebula.identity.session.SessionContextFilter}.
 */
@Provider
@RequiresRole
@Priority(Priorities.AUTHORIZATION)
public class RoleGuardFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(RoleGuardFilter.class);

    @Context
    ResourceInfo resourceInfo;

    @Inject
    SessionContext sessionContext;

    @Inject
    AuthorizationGate gate;

    @Override
    public void filter(ContainerRequestContext ctx) {
        RequiresRole guard = resolveGuard();
        if (guard == null) {
            return;
        }

        try {
            gate.check(sessionContext.currentUser(), guard.value(), Arrays.asList(guard.anyOf()));
        } catch (AuthException e) {
            LOG.debugf("Request to %s refused: %s (%s)", ctx.getUriInfo().getPath(), e.failure().code(), e.detail());
            ctx.abortWith(AuthExceptionMapper.toResponse(e.failure()));
        }
    }

    private RequiresRole resolveGuard() {
        Method method = resourceInfo.getResourceMethod();
        if (method != null && method.isAnnotationPresent(RequiresRole.class)) {
            return method.getAnnotation(RequiresRole.class);
        }
        Class<?> resourceClass = resourceInfo.getResourceClass();
        return resourceClass != null ? resourceClass.getAnnotation(RequiresRole.class) : null;
    }
}
