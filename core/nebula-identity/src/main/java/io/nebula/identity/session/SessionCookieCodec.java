package io.nebula.identity.session;

import io.nebula.identity.authentication.AuthConfig;
import io.nebula.identity.shared.SecureTokens;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.Optional;

/**
 * Signs session ids for the session cookie.
 *
 * Cookie value format: {@code <sessionId>.<base64url(HMAC-SHA256(secret, sessionId))>}
 */
@ApplicationScoped
public class SessionCookieCodec {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    @Inject
    AuthConfig authConfig;

    public String encode(String sessionId) {
        return sessionId + "." + sign(sessionId);
    }

    /**
     * @return the session id, or empty when the value is missing, malformed or not signed with our secret
     */
    public Optional<String> decode(String cookieValue) {
        if (cookieValue == null || cookieValue.isBlank()) {
            return Optional.empty();
        }
        int separator = cookieValue.lastIndexOf('.');
        if (separator <= 0 || separator == cookieValue.length() - 1) {
            return Optional.empty();
        }

        String sessionId = cookieValue.substring(0, separator);
        String signature = cookieValue.substring(separator + 1);
        return SecureTokens.constantTimeEquals(sign(sessionId), signature)
            ? Optional.of(sessionId)
            : Optional.empty();
    }

    private String sign(String value) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            byte[] key = authConfig.session().secret().getBytes(StandardCharsets.UTF_8);
            mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
            byte[] signature = mac.doFinal(value.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(signature);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot sign session cookie", e);
        }
    }
}
