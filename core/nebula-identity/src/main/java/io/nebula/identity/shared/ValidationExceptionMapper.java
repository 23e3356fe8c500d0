package io.nebula.identity.shared;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.util.Map;
import java.util.stream.Collectors;

@Provider
public class ValidationExceptionMapper implements ExceptionMapper<ConstraintViolationException> {

    @Override
    public Response toResponse(ConstraintViolationException exception) {
        String errorMessage = exception.getConstraintViolations()
            .stream()
            .map(ConstraintViolation::getMessage)
            .sorted()
            .collect(Collectors.joining(", "));

        return Response
            .status(Response.Status.BAD_REQUEST)
            .entity(Map.of("error", errorMessage, "code", "validation_failed"))
            .type(MediaType.APPLICATION_JSON)
            .build();
    }
}
