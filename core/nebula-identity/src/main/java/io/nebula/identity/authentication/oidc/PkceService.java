package io.nebula.identity.authentication.oidc;

import jakarta.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * PKCE (Proof Key for Code Exchange) for the login flow where Nebula is the client.
 *
 * Flow:
 * 1. Generate a random code_verifier and keep it in the session
 * 2. Send code_challenge = BASE64URL(SHA256(code_verifier)) in the authorization request
 * 3. Send the code_verifier in the token request; the provider checks it against the challenge
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@ApplicationScoped
public class PkceService {

    public static final String METHOD_S256 = "S256";

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    /**
     * Generate a cryptographically random code verifier.
     *
     * Per RFC 7636, the verifier must be between 43 and 128 characters of
     * unreserved URI characters. 48 random bytes encode to 64 base64url characters.
     */
    public String generateCodeVerifier() {
        byte[] bytes = new byte[48];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Generate a code challenge from a verifier using the S256 method.
     *
     * @param codeVerifier The code verifier to hash
     * @return The code challenge (base64url encoded SHA-256 hash)
     */
    public String generateCodeChallenge(String codeVerifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Check that a verifier belongs to a challenge (S256 only).
     */
    public boolean verifyCodeChallenge(String codeVerifier, String codeChallenge) {
        if (codeVerifier == null || codeChallenge == null) {
            return false;
        }
        return MessageDigest.isEqual(
            generateCodeChallenge(codeVerifier).getBytes(StandardCharsets.US_ASCII),
            codeChallenge.getBytes(StandardCharsets.US_ASCII)
        );
    }

    /**
     * Validate code verifier format.
     */
    public boolean isValidCodeVerifier(String codeVerifier) {
        if (codeVerifier == null) {
            return false;
        }
        if (codeVerifier.length() < 43 || codeVerifier.length() > 128) {
            return false;
        }
        return codeVerifier.matches("^[A-Za-z0-9\\-._~]+$");
    }
}
