package io.nebula.identity.authentication.oidc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nebula.identity.authentication.AuthConfig;
import io.nebula.identity.authentication.AuthException;
import io.nebula.identity.authentication.AuthFailure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

/**
 * Turns a raw ID token into a {@link FederatedIdentity}, or fails closed.
 *
 * Checks, in order: signature (when enabled), issuer, audience, expiry, nonce,
 * then the required subject and email claims.
 *
 * Claim mapping:
 * <ul>
 *   <li>subject: {@code oid}, else {@code sub}</li>
 *   <li>tenant: {@code tid}</li>
 *   <li>email: {@code email}, else {@code preferred_username} when it is an address</li>
 *   <li>display name: {@code name}</li>
 * </ul>
 */
@ApplicationScoped
public class IdTokenValidator {

    private static final Logger LOG = Logger.getLogger(IdTokenValidator.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Inject
    AuthConfig authConfig;

    @Inject
    JwksService jwksService;

    /**
     * @param idToken       compact-serialized ID token
     * @param expectedNonce nonce stored when the login started
     * @throws AuthException SECURITY_VALIDATION_FAILED on any failed check
     */
    public FederatedIdentity validate(String idToken, String expectedNonce) {
        if (idToken == null) {
            throw rejected("missing ID token");
        }
        String[] parts = idToken.split("\\.");
        if (parts.length != 3) {
            throw rejected("invalid ID token format");
        }

        AuthConfig.OidcConfig oidc = authConfig.oidc();

        if (oidc.verifySignature()) {
            try {
                if (!jwksService.verifySignature(idToken)) {
                    throw rejected("ID token signature does not verify");
                }
            } catch (JwksService.JwksException e) {
                LOG.warnf("ID token signature check failed: %s", e.getMessage());
                throw new AuthException(AuthFailure.SECURITY_VALIDATION_FAILED, e.getMessage(), e);
            }
        }

        JsonNode payload = decodePayload(parts[1]);

        Optional<String> expectedIssuer = oidc.issuerUrl();
        if (expectedIssuer.isPresent()) {
            String issuer = text(payload, "iss");
            if (issuer == null || !stripSlash(issuer).equals(stripSlash(expectedIssuer.get()))) {
                throw rejected("unexpected issuer " + issuer);
            }
        }

        Optional<String> clientId = oidc.clientId();
        if (clientId.isPresent() && !hasAudience(payload.path("aud"), clientId.get())) {
            throw rejected("token not issued for this client");
        }

        long exp = payload.path("exp").asLong(0);
        if (exp == 0 || Instant.ofEpochSecond(exp).plus(oidc.clockSkew()).isBefore(Instant.now())) {
            throw rejected("ID token expired");
        }

        if (expectedNonce != null && !expectedNonce.equals(text(payload, "nonce"))) {
            throw rejected("nonce mismatch");
        }

        String subject = text(payload, "oid");
        if (subject == null) {
            subject = text(payload, "sub");
        }
        if (subject == null) {
            throw rejected("no subject claim");
        }

        String email = text(payload, "email");
        if (email == null) {
            String preferred = text(payload, "preferred_username");
            email = preferred != null && preferred.contains("@") ? preferred : null;
        }
        if (email == null || email.indexOf('@') <= 0 || email.endsWith("@")) {
            throw rejected("no usable email claim");
        }

        return new FederatedIdentity(
            subject,
            text(payload, "tid"),
            email,
            text(payload, "name"),
            payload.path("email_verified").asBoolean(true)
        );
    }

    private JsonNode decodePayload(String encoded) {
        try {
            String json = new String(Base64.getUrlDecoder().decode(encoded), StandardCharsets.UTF_8);
            JsonNode payload = MAPPER.readTree(json);
            if (payload == null || !payload.isObject()) {
                throw rejected("ID token payload is not a JSON object");
            }
            return payload;
        } catch (IllegalArgumentException | IOException e) {
            throw new AuthException(AuthFailure.SECURITY_VALIDATION_FAILED, "undecodable ID token payload", e);
        }
    }

    private static boolean hasAudience(JsonNode aud, String clientId) {
        if (aud.isTextual()) {
            return clientId.equals(aud.asText());
        }
        if (aud.isArray()) {
            for (JsonNode entry : aud) {
                if (clientId.equals(entry.asText())) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String text(JsonNode payload, String claim) {
        String value = payload.path(claim).asText(null);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static AuthException rejected(String detail) {
        LOG.warnf("ID token rejected: %s", detail);
        return new AuthException(AuthFailure.SECURITY_VALIDATION_FAILED, detail);
    }
}
