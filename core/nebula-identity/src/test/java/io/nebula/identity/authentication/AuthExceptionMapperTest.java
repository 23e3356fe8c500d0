package io.nebula.identity.authentication;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AuthExceptionMapper.
 */
class AuthExceptionMapperTest {

    private final AuthExceptionMapper mapper = new AuthExceptionMapper();

    @Test
    @DisplayName("toResponse should render the failure as error and code with its status")
    void toResponse_shouldRenderErrorBody_whenAuthExceptionThrown() {
        // Act
        Response response = mapper.toResponse(
            new AuthException(AuthFailure.INSUFFICIENT_PERMISSIONS, "user usr_1 outside organization org_2"));

        // Assert
        assertThat(response.getStatus()).isEqualTo(403);
        assertThat(response.getMediaType()).isEqualTo(MediaType.APPLICATION_JSON_TYPE);
        AuthExceptionMapper.ErrorResponse body = (AuthExceptionMapper.ErrorResponse) response.getEntity();
        assertThat(body.error()).isEqualTo(AuthFailure.INSUFFICIENT_PERMISSIONS.message());
        assertThat(body.code()).isEqualTo(AuthFailure.INSUFFICIENT_PERMISSIONS.code());
    }

    @Test
    @DisplayName("toResponse should keep the internal detail out of the body")
    void toResponse_shouldOmitDetail_whenDetailPresent() {
        Response response = mapper.toResponse(
            new AuthException(AuthFailure.INVALID_CREDENTIALS, "no such user ada@acme.com"));

        AuthExceptionMapper.ErrorResponse body = (AuthExceptionMapper.ErrorResponse) response.getEntity();
        assertThat(body.error()).doesNotContain("ada@acme.com");
        assertThat(response.getStatus()).isEqualTo(401);
    }

    @Test
    @DisplayName("every failure should map to its own status and code")
    void toResponse_shouldUseFailureStatus_forEveryFailure() {
        for (AuthFailure failure : AuthFailure.values()) {
            Response response = AuthExceptionMapper.toResponse(failure);

            assertThat(response.getStatus()).as(failure.name()).isEqualTo(failure.status().getStatusCode());
            assertThat(((AuthExceptionMapper.ErrorResponse) response.getEntity()).code()).isEqualTo(failure.code());
        }
    }
}
