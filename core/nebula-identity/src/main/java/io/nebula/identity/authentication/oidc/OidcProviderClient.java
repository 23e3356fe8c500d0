package io.nebula.identity.authentication.oidc;

import java.util.Optional;

/**
 * Client side of the OAuth2 authorization code flow against one identity provider.
 */
public interface OidcProviderClient {

    /**
     * Whether client credentials and endpoints are present.
     */
    boolean isConfigured();

    /**
     * Build the URL the browser is sent to for authentication.
     */
    String authorizationUrl(AuthorizationRequest request);

    /**
     * Exchange an authorization code and its PKCE verifier for tokens.
     *
     * @throws FederationException if the provider rejects the code or cannot be reached
     */
    TokenSet exchangeCode(String code, String codeVerifier, String redirectUri) throws FederationException;

    /**
     * Provider logout URL that returns the browser to the given address, if the provider has one.
     */
    Optional<String> endSessionUrl(String postLogoutRedirectUri);

    record AuthorizationRequest(String redirectUri, String state, String nonce, String codeChallenge) {}

    record TokenSet(String accessToken, String idToken, String refreshToken) {}
}
