package io.nebula.identity.authentication.oidc;

/**
 * Failure talking to the identity provider.
 *
 * Retryable failures (timeouts, connection errors, provider 5xx) mean the whole
 * login can be attempted again. The others mean the provider rejected the request.
 */
public class FederationException extends Exception {

    private final boolean retryable;

    public FederationException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public FederationException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
