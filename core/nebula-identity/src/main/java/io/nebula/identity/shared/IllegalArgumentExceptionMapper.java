package io.nebula.identity.shared;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.util.Map;

/**
 * Maps input validation failures raised by services (password policy,
 * malformed email, unknown role) to 400 Bad Request.
 */
@Provider
public class IllegalArgumentExceptionMapper implements ExceptionMapper<IllegalArgumentException> {

    @Override
    public Response toResponse(IllegalArgumentException exception) {
        String message = exception.getMessage() != null ? exception.getMessage() : "Invalid request";
        return Response.status(Response.Status.BAD_REQUEST)
            .entity(Map.of("error", message, "code", "invalid_request"))
            .type(MediaType.APPLICATION_JSON)
            .build();
    }
}
