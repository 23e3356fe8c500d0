package io.nebula.identity.authentication;

import jakarta.ws.rs.core.Response;

import java.util.Locale;

/**
 * Every way authentication or authorization can fail, with the HTTP status and
 * the user-facing message. Messages are generic and never reveal
 * whether an account exists.
 */
public enum AuthFailure {

    INVALID_CREDENTIALS(Response.Status.UNAUTHORIZED,
        "Invalid email or password"),
    EMAIL_NOT_VERIFIED(Response.Status.FORBIDDEN,
        "Please verify your email address before logging in. Check your inbox for the verification link."),
    INVALID_ACCOUNT_TOKEN(Response.Status.BAD_REQUEST,
        "This link is invalid, already used or expired. Please request a new one."),
    MAIL_DELIVERY_FAILED(Response.Status.INTERNAL_SERVER_ERROR,
        "The email could not be sent. Please try again later."),
    DUPLICATE_ACCOUNT(Response.Status.CONFLICT,
        "An account with this email already exists"),
    FEDERATION_DENIED(Response.Status.UNAUTHORIZED,
        "Sign-in was cancelled or denied by the identity provider"),
    SECURITY_VALIDATION_FAILED(Response.Status.UNAUTHORIZED,
        "Security validation failed. Please try signing in again."),
    INVITATION_REQUIRED(Response.Status.FORBIDDEN,
        "This organization requires an invitation to join"),
    SSO_DISABLED_FOR_TENANT(Response.Status.FORBIDDEN,
        "Single sign-on is disabled for your organization. Please sign in with your password."),
    FEDERATION_UNAVAILABLE(Response.Status.SERVICE_UNAVAILABLE,
        "The identity provider is unavailable. Please try again."),
    PROVISIONING_CONFLICT(Response.Status.INTERNAL_SERVER_ERROR,
        "Your account could not be set up. Please try again."),
    SSO_NOT_CONFIGURED(Response.Status.SERVICE_UNAVAILABLE,
        "Single sign-on is not configured"),
    AUTHENTICATION_REQUIRED(Response.Status.UNAUTHORIZED,
        "Not authenticated"),
    INSUFFICIENT_PERMISSIONS(Response.Status.FORBIDDEN,
        "Insufficient permissions");

    private final Response.Status status;
    private final String message;

    AuthFailure(Response.Status status, String message) {
        this.status = status;
        this.message = message;
    }

    public Response.Status status() {
        return status;
    }

    public String message() {
        return message;
    }

    /**
     * Stable wire code, e.g. "security_validation_failed".
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether repeating the whole login attempt can succeed.
     */
    public boolean isRetryable() {
        return this == FEDERATION_UNAVAILABLE;
    }
}
