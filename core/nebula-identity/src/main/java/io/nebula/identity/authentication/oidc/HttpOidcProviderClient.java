package io.nebula.identity.authentication.oidc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nebula.identity.authentication.AuthConfig;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link OidcProviderClient} over java.net.http.
 *
 * Endpoints not configured explicitly are derived from the issuer URL.
 * Entra ID issuers ("https://login.microsoftonline.com/{tenant}/v2.0") map to
 * their oauth2/v2.0 endpoints; other issuers get /authorize, /token and /logout.
 */
@ApplicationScoped
public class HttpOidcProviderClient implements OidcProviderClient {

    private static final Logger LOG = Logger.getLogger(HttpOidcProviderClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String BASE_SCOPES = "openid profile email";

    @Inject
    AuthConfig authConfig;

    HttpClient httpClient;

    @PostConstruct
    void init() {
        httpClient = HttpClient.newBuilder()
            .connectTimeout(authConfig.oidc().connectTimeout())
            .build();
    }

    @Override
    public boolean isConfigured() {
        AuthConfig.OidcConfig oidc = authConfig.oidc();
        boolean credentials = isPresent(oidc.clientId()) && isPresent(oidc.clientSecret());
        boolean endpoints = isPresent(oidc.issuerUrl())
            || (isPresent(oidc.authorizationEndpoint()) && isPresent(oidc.tokenEndpoint()));
        return credentials && endpoints;
    }

    @Override
    public String authorizationUrl(AuthorizationRequest request) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("response_type", "code");
        params.put("client_id", clientId());
        params.put("redirect_uri", request.redirectUri());
        params.put("response_mode", "query");
        params.put("scope", scopes());
        params.put("state", request.state());
        params.put("nonce", request.nonce());
        params.put("code_challenge", request.codeChallenge());
        params.put("code_challenge_method", PkceService.METHOD_S256);
        params.put("prompt", "select_account");

        return authorizationEndpoint() + "?" + formEncode(params);
    }

    @Override
    public TokenSet exchangeCode(String code, String codeVerifier, String redirectUri) throws FederationException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "authorization_code");
        form.put("code", code);
        form.put("redirect_uri", redirectUri);
        form.put("client_id", clientId());
        form.put("code_verifier", codeVerifier);
        authConfig.oidc().clientSecret().ifPresent(secret -> form.put("client_secret", secret));

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(tokenEndpoint()))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(formEncode(form)))
            .timeout(authConfig.oidc().requestTimeout())
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new FederationException("Token endpoint timed out", true, e);
        } catch (IOException e) {
            throw new FederationException("Token endpoint unreachable: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FederationException("Token exchange interrupted", true, e);
        }

        int status = response.statusCode();
        if (status >= 500) {
            LOG.errorf("Token endpoint returned %d", status);
            throw new FederationException("Token endpoint returned " + status, true);
        }
        if (status != 200) {
            LOG.warnf("Token endpoint rejected code exchange with %d: %s", status, errorCode(response.body()));
            throw new FederationException("Token endpoint returned " + status, false);
        }

        try {
            JsonNode json = MAPPER.readTree(response.body());
            String idToken = json.path("id_token").asText(null);
            if (idToken == null || idToken.isBlank()) {
                throw new FederationException("No ID token received from identity provider", false);
            }
            return new TokenSet(
                json.path("access_token").asText(null),
                idToken,
                json.path("refresh_token").asText(null)
            );
        } catch (IOException e) {
            throw new FederationException("Malformed token response", false, e);
        }
    }

    @Override
    public Optional<String> endSessionUrl(String postLogoutRedirectUri) {
        return endSessionEndpoint()
            .map(endpoint -> {
                Map<String, String> params = new LinkedHashMap<>();
                params.put("client_id", clientId());
                params.put("post_logout_redirect_uri", postLogoutRedirectUri);
                return endpoint + "?" + formEncode(params);
            });
    }

    // ==================== Endpoints ====================

    String authorizationEndpoint() {
        return authConfig.oidc().authorizationEndpoint()
            .orElseGet(() -> deriveEndpoint("authorize"));
    }

    String tokenEndpoint() {
        return authConfig.oidc().tokenEndpoint()
            .orElseGet(() -> deriveEndpoint("token"));
    }

    Optional<String> endSessionEndpoint() {
        if (authConfig.oidc().endSessionEndpoint().isPresent()) {
            return authConfig.oidc().endSessionEndpoint();
        }
        return authConfig.oidc().issuerUrl().map(issuer -> deriveEndpoint("logout"));
    }

    private String deriveEndpoint(String name) {
        String issuerUrl = authConfig.oidc().issuerUrl()
            .orElseThrow(() -> new IllegalStateException("nebula.auth.oidc.issuer-url is not configured"));
        if (issuerUrl.contains("login.microsoftonline.com")) {
            return issuerUrl.replace("/v2.0", "/oauth2/v2.0/" + name);
        }
        return issuerUrl + (issuerUrl.endsWith("/") ? "" : "/") + name;
    }

    // ==================== Helpers ====================

    private String clientId() {
        return authConfig.oidc().clientId()
            .orElseThrow(() -> new IllegalStateException("nebula.auth.oidc.client-id is not configured"));
    }

    private String scopes() {
        List<String> scopes = new ArrayList<>(List.of(BASE_SCOPES.split(" ")));
        authConfig.oidc().extraScopes().ifPresent(extra -> extra.stream()
            .map(String::trim)
            .filter(scope -> !scope.isEmpty() && !scopes.contains(scope))
            .forEach(scopes::add));
        return String.join(" ", scopes);
    }

    private static String errorCode(String body) {
        try {
            return MAPPER.readTree(body).path("error").asText("unknown");
        } catch (IOException e) {
            return "unparseable";
        }
    }

    private static boolean isPresent(Optional<String> value) {
        return value.filter(v -> !v.isBlank()).isPresent();
    }

    private static String formEncode(Map<String, String> params) {
        return params.entrySet().stream()
            .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
            .collect(Collectors.joining("&"));
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
