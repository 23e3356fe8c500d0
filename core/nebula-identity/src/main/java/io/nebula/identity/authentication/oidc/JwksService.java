package io.nebula.identity.authentication.oidc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nebula.identity.authentication.AuthConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.math.BigInteger;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.KeyFactory;
import java.security.Signature;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.RSAPublicKeySpec;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fetches and caches the provider's JSON Web Key Set and verifies ID token signatures.
 *
 * <p>Only RS256 is accepted. Keys are cached by key id; an unknown key id
 * triggers one refresh, which covers provider key rotation.
 */
@ApplicationScoped
public class JwksService {

    private static final Logger LOG = Logger.getLogger(JwksService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Inject
    AuthConfig authConfig;

    private final HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .build();

    private final Map<String, RSAPublicKey> keyCache = new ConcurrentHashMap<>();

    private volatile String discoveredJwksUri;

    /**
     * Verify the signature of a JWT.
     *
     * @param token The complete JWT (header.payload.signature)
     * @return true if the signature is valid
     * @throws JwksException if the token is malformed or the key cannot be obtained
     */
    public boolean verifySignature(String token) throws JwksException {
        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            throw new JwksException("Invalid JWT format - expected 3 parts");
        }

        try {
            String headerJson = new String(Base64.getUrlDecoder().decode(parts[0]), StandardCharsets.UTF_8);
            JsonNode header = MAPPER.readTree(headerJson);

            String alg = header.path("alg").asText(null);
            String kid = header.path("kid").asText(null);

            // Only allow RS256 - prevent algorithm confusion attacks
            if (!"RS256".equals(alg)) {
                LOG.warnf("Rejecting token with unsupported algorithm: %s (only RS256 allowed)", alg);
                throw new JwksException("Unsupported JWT algorithm: " + alg);
            }

            if (kid == null || kid.isBlank()) {
                throw new JwksException("JWT missing key ID (kid) in header");
            }

            RSAPublicKey publicKey = getPublicKey(kid);

            Signature sig = Signature.getInstance("SHA256withRSA");
            sig.initVerify(publicKey);
            sig.update((parts[0] + "." + parts[1]).getBytes(StandardCharsets.UTF_8));
            return sig.verify(Base64.getUrlDecoder().decode(parts[2]));

        } catch (JwksException e) {
            throw e;
        } catch (Exception e) {
            throw new JwksException("Failed to verify JWT signature: " + e.getMessage(), e);
        }
    }

    /**
     * Get the RSA public key for a key id, refreshing the key set once on a miss.
     */
    RSAPublicKey getPublicKey(String kid) throws JwksException {
        RSAPublicKey cached = keyCache.get(kid);
        if (cached != null) {
            return cached;
        }

        LOG.infof("Key ID %s not cached, fetching JWKS", kid);
        refreshKeys();

        RSAPublicKey key = keyCache.get(kid);
        if (key == null) {
            throw new JwksException("Key ID " + kid + " not found in provider JWKS");
        }
        return key;
    }

    private void refreshKeys() throws JwksException {
        String jwksUri = jwksUri();
        JsonNode jwks = fetchJson(jwksUri, "JWKS");
        if (!jwks.has("keys") || !jwks.get("keys").isArray()) {
            throw new JwksException("Invalid JWKS format - missing 'keys' array");
        }

        keyCache.clear();
        for (JsonNode key : jwks.get("keys")) {
            String kid = key.path("kid").asText(null);
            if (kid == null) {
                continue;
            }
            if (!"RSA".equals(key.path("kty").asText(null))) {
                continue;
            }
            String use = key.path("use").asText(null);
            if (use != null && !"sig".equals(use)) {
                continue;
            }
            keyCache.put(kid, parseRsaPublicKey(key));
        }
        LOG.infof("Loaded %d signing keys from %s", keyCache.size(), jwksUri);
    }

    /**
     * JWKS URI from configuration, else discovered from the issuer's OpenID configuration.
     */
    private String jwksUri() throws JwksException {
        if (authConfig.oidc().jwksUri().isPresent()) {
            return authConfig.oidc().jwksUri().get();
        }
        if (discoveredJwksUri != null) {
            return discoveredJwksUri;
        }

        String issuerUrl = authConfig.oidc().issuerUrl()
            .orElseThrow(() -> new JwksException("Neither jwks-uri nor issuer-url is configured"));
        String configUrl = issuerUrl + (issuerUrl.endsWith("/") ? "" : "/") + ".well-known/openid-configuration";

        String jwksUri = fetchJson(configUrl, "OpenID configuration").path("jwks_uri").asText(null);
        if (jwksUri == null || jwksUri.isBlank()) {
            throw new JwksException("OpenID configuration missing jwks_uri");
        }
        discoveredJwksUri = jwksUri;
        return jwksUri;
    }

    private JsonNode fetchJson(String url, String what) throws JwksException {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .GET()
                .timeout(authConfig.oidc().requestTimeout())
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new JwksException("Failed to fetch " + what + ": HTTP " + response.statusCode());
            }
            return MAPPER.readTree(response.body());

        } catch (JwksException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JwksException("Interrupted while fetching " + what, e);
        } catch (Exception e) {
            throw new JwksException("Failed to fetch " + what + ": " + e.getMessage(), e);
        }
    }

    private RSAPublicKey parseRsaPublicKey(JsonNode keyNode) throws JwksException {
        try {
            String n = keyNode.path("n").asText(null);
            String e = keyNode.path("e").asText(null);
            if (n == null || e == null) {
                throw new JwksException("RSA key missing modulus (n) or exponent (e)");
            }

            BigInteger modulus = new BigInteger(1, Base64.getUrlDecoder().decode(n));
            BigInteger exponent = new BigInteger(1, Base64.getUrlDecoder().decode(e));

            KeyFactory factory = KeyFactory.getInstance("RSA");
            return (RSAPublicKey) factory.generatePublic(new RSAPublicKeySpec(modulus, exponent));

        } catch (JwksException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new JwksException("Failed to parse RSA public key: " + ex.getMessage(), ex);
        }
    }

    /**
     * Exception for JWKS-related errors.
     */
    public static class JwksException extends Exception {
        public JwksException(String message) {
            super(message);
        }
        public JwksException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
