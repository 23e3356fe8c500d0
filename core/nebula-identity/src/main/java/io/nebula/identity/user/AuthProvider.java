package io.nebula.identity.user;

/**
 * How a user account authenticates.
 */
public enum AuthProvider {
    /**
     * Email and password verified locally.
     */
    LOCAL,

    /**
     * Federated sign-on through the configured OIDC provider.
     */
    OIDC
}
