package io.nebula.identity.authentication;

import io.nebula.identity.account.EmailVerificationService;
import io.nebula.identity.account.PasswordResetService;
import io.nebula.identity.authentication.AuthResource.MessageResponse;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.*;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Email verification and password reset for local accounts.
 *
 * Requests naming an email address always answer with the same message,
 * whether or not the address is registered.
 */
@Path("/auth")
@Tag(name = "Account", description = "Email verification and password reset")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AccountResource {

    static final String VERIFICATION_SENT = "If that email is registered and unverified, a verification link has been sent.";
    static final String RESET_SENT = "If that email is registered, a password reset link has been sent.";

    @Inject
    EmailVerificationService emailVerificationService;

    @Inject
    PasswordResetService passwordResetService;

    @Inject
    BaseUrlResolver baseUrlResolver;

    @Context
    UriInfo uriInfo;

    @Context
    HttpHeaders headers;

    @POST
    @Path("/verify-email")
    @Operation(summary = "Verify an email address with the token from the verification mail")
    @APIResponse(responseCode = "200", description = "Email verified")
    @APIResponse(responseCode = "400", description = "Invalid, used or expired token")
    public MessageResponse verifyEmail(@Valid TokenRequest request) {
        emailVerificationService.verifyEmail(request.token());
        return new MessageResponse("Email verified successfully. You can now log in.");
    }

    @POST
    @Path("/resend-verification")
    @Operation(summary = "Send a new verification link")
    @APIResponse(responseCode = "200", description = "Request accepted")
    @APIResponse(responseCode = "500", description = "Mail could not be sent")
    public MessageResponse resendVerification(@Valid EmailRequest request) {
        emailVerificationService.resendVerification(request.email(), baseUrl());
        return new MessageResponse(VERIFICATION_SENT);
    }

    @POST
    @Path("/request-password-reset")
    @Operation(summary = "Mail a password reset link")
    @APIResponse(responseCode = "200", description = "Request accepted")
    @APIResponse(responseCode = "500", description = "Mail could not be sent")
    public MessageResponse requestPasswordReset(@Valid EmailRequest request) {
        passwordResetService.requestReset(request.email(), baseUrl());
        return new MessageResponse(RESET_SENT);
    }

    /**
     * Lets the reset page check a link before asking for a new password.
     */
    @POST
    @Path("/verify-reset-token")
    @Operation(summary = "Check whether a reset token can still be used")
    @APIResponse(responseCode = "200", description = "Token is valid")
    @APIResponse(responseCode = "400", description = "Invalid, used or expired token")
    public TokenStatusResponse verifyResetToken(@Valid TokenRequest request) {
        if (!passwordResetService.isResetTokenValid(request.token())) {
            throw new AuthException(AuthFailure.INVALID_ACCOUNT_TOKEN);
        }
        return new TokenStatusResponse(true, "Token is valid");
    }

    @POST
    @Path("/reset-password")
    @Operation(summary = "Set a new password with a reset token")
    @APIResponse(responseCode = "200", description = "Password changed, all sessions signed out")
    @APIResponse(responseCode = "400", description = "Invalid token or password")
    public MessageResponse resetPassword(@Valid ResetPasswordRequest request) {
        passwordResetService.resetPassword(request.token(), request.newPassword());
        return new MessageResponse("Password reset successful. You can now log in with your new password.");
    }

    private String baseUrl() {
        return baseUrlResolver.resolve(headers, uriInfo);
    }

    // DTOs

    public record TokenRequest(@NotBlank @Size(max = 128) String token) {}

    public record EmailRequest(@NotBlank @Email String email) {}

    public record ResetPasswordRequest(
            @NotBlank @Size(max = 128) String token,
            @NotBlank @Size(max = 128) String newPassword
    ) {}

    public record TokenStatusResponse(boolean valid, String message) {}
}
