package io.nebula.identity.authentication;

/**
 * Authentication or authorization failure carrying one {@link AuthFailure}.
 *
 * <p>{@link #getMessage()} is the user-facing text. The optional detail is for
 * logs only and never reaches the client.
 */
public class AuthException extends RuntimeException {

    private final AuthFailure failure;
    private final String detail;

    public AuthException(AuthFailure failure) {
        this(failure, null, null);
    }

    public AuthException(AuthFailure failure, String detail) {
        this(failure, detail, null);
    }

    public AuthException(AuthFailure failure, String detail, Throwable cause) {
        super(failure.message(), cause);
        this.failure = failure;
        this.detail = detail;
    }

    public AuthFailure failure() {
        return failure;
    }

    public String detail() {
        return detail;
    }
}
