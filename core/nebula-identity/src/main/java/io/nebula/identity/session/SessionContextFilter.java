package io.nebula.identity.session;

import io.nebula.identity.authentication.AuthConfig;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * JAX-RS filter that reads the signed session cookie into {@link SessionContext}.
 * Cookies with a bad signature are ignored, so the request is anonymous.
 */
@Provider
@Priority(Priorities.AUTHENTICATION)
public class SessionContextFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(SessionContextFilter.class);

    @Inject
    SessionContext sessionContext;

    @Inject
    SessionCookieCodec cookieCodec;

    @Inject
    AuthConfig authConfig;

    @Override
    public void filter(ContainerRequestContext ctx) {
        Cookie cookie = ctx.getCookies().get(authConfig.session().cookieName());
        if (cookie == null || cookie.getValue() == null || cookie.getValue().isEmpty()) {
            return;
        }

        cookieCodec.decode(cookie.getValue()).ifPresentOrElse(
            sessionContext::setSessionId,
            () -> LOG.warnf("Ignoring session cookie with invalid signature on %s", ctx.getUriInfo().getPath())
        );
    }
}
