package io.nebula.identity.authentication.oidc;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nebula.identity.authentication.AuthConfig;
import io.nebula.identity.authentication.AuthException;
import io.nebula.identity.authentication.AuthFailure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for IdTokenValidator.
 * Signature checking is switched off except where a test turns it on.
 */
class IdTokenValidatorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String ISSUER = "https://login.example.com/tenant-1/v2.0";
    private static final String CLIENT_ID = "client-1";
    private static final String NONCE = "nonce-123";

    private AuthConfig authConfig;
    private JwksService jwksService;
    private IdTokenValidator validator;

    @BeforeEach
    void setUp() {
        authConfig = mock(AuthConfig.class, RETURNS_DEEP_STUBS);
        when(authConfig.oidc().verifySignature()).thenReturn(false);
        when(authConfig.oidc().issuerUrl()).thenReturn(Optional.of(ISSUER));
        when(authConfig.oidc().clientId()).thenReturn(Optional.of(CLIENT_ID));
        when(authConfig.oidc().clockSkew()).thenReturn(Duration.ofSeconds(60));

        jwksService = mock(JwksService.class);

        validator = new IdTokenValidator();
        validator.authConfig = authConfig;
        validator.jwksService = jwksService;
    }

    // ========================================
    // CLAIM MAPPING
    // ========================================

    @Test
    @DisplayName("validate should map oid, tid, email and name claims")
    void validate_shouldMapClaims_whenTokenValid() throws Exception {
        // Arrange
        Map<String, Object> claims = validClaims();
        claims.put("oid", "object-id-1");
        claims.put("tid", "T1");
        claims.put("email", "Alice@Acme.com");
        claims.put("name", "Alice Smith");

        // Act
        FederatedIdentity identity = validator.validate(token(claims), NONCE);

        // Assert
        assertThat(identity.subjectId()).isEqualTo("object-id-1");
        assertThat(identity.tenantId()).isEqualTo("T1");
        assertThat(identity.email()).isEqualTo("alice@acme.com");
        assertThat(identity.displayName()).isEqualTo("Alice Smith");
        assertThat(identity.emailVerified()).isTrue();
    }

    @Test
    @DisplayName("validate should fall back to sub and preferred_username")
    void validate_shouldUseFallbackClaims_whenPrimaryMissing() throws Exception {
        // Arrange
        Map<String, Object> claims = validClaims();
        claims.remove("email");
        claims.put("preferred_username", "bob@acme.com");

        // Act
        FederatedIdentity identity = validator.validate(token(claims), NONCE);

        // Assert
        assertThat(identity.subjectId()).isEqualTo("subject-1");
        assertThat(identity.email()).isEqualTo("bob@acme.com");
        assertThat(identity.tenantId()).isNull();
        assertThat(identity.displayName()).isEqualTo("bob");
    }

    @Test
    @DisplayName("validate should accept an audience array containing the client id")
    void validate_shouldAcceptAudienceArray() throws Exception {
        Map<String, Object> claims = validClaims();
        claims.put("aud", List.of("other", CLIENT_ID));

        assertThat(validator.validate(token(claims), NONCE).subjectId()).isEqualTo("subject-1");
    }

    @Test
    @DisplayName("validate should tolerate a trailing slash difference in the issuer")
    void validate_shouldAcceptIssuer_whenOnlyTrailingSlashDiffers() throws Exception {
        Map<String, Object> claims = validClaims();
        claims.put("iss", ISSUER + "/");

        assertThat(validator.validate(token(claims), NONCE)).isNotNull();
    }

    // ========================================
    // REJECTIONS
    // ========================================

    @Test
    @DisplayName("validate should reject tokens from another issuer")
    void validate_shouldReject_whenIssuerDiffers() throws Exception {
        Map<String, Object> claims = validClaims();
        claims.put("iss", "https://evil.example.com");

        assertRejected(token(claims), NONCE);
    }

    @Test
    @DisplayName("validate should reject tokens for another client")
    void validate_shouldReject_whenAudienceDiffers() throws Exception {
        Map<String, Object> claims = validClaims();
        claims.put("aud", "someone-else");

        assertRejected(token(claims), NONCE);
    }

    @Test
    @DisplayName("validate should reject expired tokens beyond the clock skew")
    void validate_shouldReject_whenExpired() throws Exception {
        Map<String, Object> claims = validClaims();
        claims.put("exp", Instant.now().minusSeconds(120).getEpochSecond());

        assertRejected(token(claims), NONCE);
    }

    @Test
    @DisplayName("validate should reject a replayed nonce")
    void validate_shouldReject_whenNonceDiffers() throws Exception {
        assertRejected(token(validClaims()), "another-nonce");
    }

    @Test
    @DisplayName("validate should reject tokens without a usable email")
    void validate_shouldReject_whenEmailMissing() throws Exception {
        Map<String, Object> claims = validClaims();
        claims.remove("email");
        claims.put("preferred_username", "not-an-address");

        assertRejected(token(claims), NONCE);
    }

    @Test
    @DisplayName("validate should reject malformed tokens")
    void validate_shouldReject_whenMalformed() {
        assertRejected(null, NONCE);
        assertRejected("only.two", NONCE);
        assertRejected("a.%%%.c", NONCE);
    }

    @Test
    @DisplayName("validate should reject a token whose signature does not verify")
    void validate_shouldReject_whenSignatureInvalid() throws Exception {
        // Arrange
        when(authConfig.oidc().verifySignature()).thenReturn(true);
        String token = token(validClaims());
        when(jwksService.verifySignature(token)).thenReturn(false);

        // Act & Assert
        assertRejected(token, NONCE);
    }

    @Test
    @DisplayName("validate should fail closed when signing keys cannot be fetched")
    void validate_shouldReject_whenKeysUnavailable() throws Exception {
        // Arrange
        when(authConfig.oidc().verifySignature()).thenReturn(true);
        String token = token(validClaims());
        when(jwksService.verifySignature(token)).thenThrow(new JwksService.JwksException("JWKS unreachable"));

        // Act & Assert
        assertRejected(token, NONCE);
    }

    private void assertRejected(String token, String nonce) {
        assertThatThrownBy(() -> validator.validate(token, nonce))
            .isInstanceOfSatisfying(AuthException.class,
                e -> assertThat(e.failure()).isEqualTo(AuthFailure.SECURITY_VALIDATION_FAILED));
    }

    private static Map<String, Object> validClaims() {
        Map<String, Object> claims = new HashMap<>();
        claims.put("iss", ISSUER);
        claims.put("aud", CLIENT_ID);
        claims.put("sub", "subject-1");
        claims.put("email", "bob@acme.com");
        claims.put("nonce", NONCE);
        claims.put("exp", Instant.now().plusSeconds(600).getEpochSecond());
        return claims;
    }

    static String token(Map<String, Object> claims) throws Exception {
        Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
        String header = encoder.encodeToString("{\"alg\":\"RS256\",\"kid\":\"k1\"}".getBytes(StandardCharsets.UTF_8));
        String payload = encoder.encodeToString(MAPPER.writeValueAsBytes(claims));
        return header + "." + payload + ".c2lnbmF0dXJl";
    }
}
