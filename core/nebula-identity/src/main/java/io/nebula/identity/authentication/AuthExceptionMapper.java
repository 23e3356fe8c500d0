package io.nebula.identity.authentication;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Renders {@link AuthException} as a JSON error body with the failure's status.
 */
@Provider
public class AuthExceptionMapper implements ExceptionMapper<AuthException> {

    private static final Logger LOG = Logger.getLogger(AuthExceptionMapper.class);

    @Override
    public Response toResponse(AuthException exception) {
        AuthFailure failure = exception.failure();
        if (exception.detail() != null) {
            LOG.debugf("%s: %s", failure.code(), exception.detail());
        }
        return toResponse(failure);
    }

    public static Response toResponse(AuthFailure failure) {
        return Response.status(failure.status())
            .entity(new ErrorResponse(failure.message(), failure.code()))
            .type(MediaType.APPLICATION_JSON)
            .build();
    }

    public record ErrorResponse(String error, String code) {}
}
