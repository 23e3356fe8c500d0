package io.nebula.identity.authentication;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Configuration for the Nebula identity module.
 *
 * Example configuration:
 * <pre>
 * nebula.auth.external-base-url=https://workshops.example.com
 * nebula.auth.session.secret=${NEBULA_SESSION_SECRET}
 *
 * nebula.auth.oidc.enabled=true
 * nebula.auth.oidc.client-id=${OIDC_CLIENT_ID}
 * nebula.auth.oidc.client-secret=${OIDC_CLIENT_SECRET}
 * nebula.auth.oidc.issuer-url=https://login.microsoftonline.com/organizations/v2.0
 * </pre>
 */
@StaticInitSafe
@ConfigMapping(prefix = "nebula.auth")
public interface AuthConfig {

    /**
     * External base URL for OIDC callbacks and logout redirects.
     * Set this to the public URL where users access the platform.
     * When absent the URL is derived from forwarded headers or the request.
     */
    @WithName("external-base-url")
    Optional<String> externalBaseUrl();

    /**
     * Honor X-Forwarded-Proto / X-Forwarded-Host when deriving the base URL.
     * Only enable behind a reverse proxy that overwrites these headers.
     */
    @WithName("trust-forwarded-headers")
    @WithDefault("true")
    boolean trustForwardedHeaders();

    /**
     * Replaces the built-in list of consumer email domains.
     */
    @WithName("public-email-domains")
    Optional<List<String>> publicEmailDomains();

    /**
     * Session/cookie configuration.
     */
    SessionConfig session();

    /**
     * Federated sign-on configuration.
     */
    OidcConfig oidc();

    /**
     * Email verification and password reset.
     */
    AccountConfig account();

    /**
     * Session configuration.
     */
    interface SessionConfig {

        @WithName("cookie-name")
        @WithDefault("nebula_session")
        String cookieName();

        /**
         * HMAC key used to sign session cookies.
         */
        String secret();

        @WithDefault("true")
        boolean secure();

        @WithName("http-only")
        @WithDefault("true")
        boolean httpOnly();

        /**
         * SameSite attribute: Strict, Lax or None.
         */
        @WithName("same-site")
        @WithDefault("Lax")
        String sameSite();

        /**
         * Lifetime of an authenticated session.
         * Default: 30 days
         */
        @WithName("max-age")
        @WithDefault("P30D")
        Duration maxAge();

        /**
         * Minimum interval between last-seen updates of a session row.
         */
        @WithName("touch-interval")
        @WithDefault("PT5M")
        Duration touchInterval();
    }

    /**
     * Account token configuration.
     */
    interface AccountConfig {

        /**
         * Refuse password login to unverified accounts with the lowest role.
         */
        @WithName("require-verified-email")
        @WithDefault("true")
        boolean requireVerifiedEmail();

        @WithName("verification-ttl")
        @WithDefault("PT24H")
        Duration verificationTtl();

        @WithName("reset-ttl")
        @WithDefault("PT1H")
        Duration resetTtl();
    }

    /**
     * OIDC provider configuration.
     */
    interface OidcConfig {

        /**
         * System-wide opt-in for federated sign-on.
         */
        @WithDefault("false")
        boolean enabled();

        @WithName("client-id")
        Optional<String> clientId();

        @WithName("client-secret")
        Optional<String> clientSecret();

        /**
         * Issuer URL. Used to validate the iss claim and to derive endpoints
         * that are not configured explicitly.
         */
        @WithName("issuer-url")
        Optional<String> issuerUrl();

        @WithName("authorization-endpoint")
        Optional<String> authorizationEndpoint();

        @WithName("token-endpoint")
        Optional<String> tokenEndpoint();

        @WithName("end-session-endpoint")
        Optional<String> endSessionEndpoint();

        @WithName("jwks-uri")
        Optional<String> jwksUri();

        /**
         * Scopes requested in addition to "openid profile email",
         * e.g. a directory-read scope.
         */
        @WithName("extra-scopes")
        Optional<List<String>> extraScopes();

        /**
         * Verify ID token signatures against the provider JWKS.
         */
        @WithName("verify-signature")
        @WithDefault("true")
        boolean verifySignature();

        @WithName("connect-timeout")
        @WithDefault("PT10S")
        Duration connectTimeout();

        @WithName("request-timeout")
        @WithDefault("PT15S")
        Duration requestTimeout();

        /**
         * How long a started login may wait for its callback.
         * Default: 10 minutes
         */
        @WithName("state-ttl")
        @WithDefault("PT10M")
        Duration stateTtl();

        @WithName("clock-skew")
        @WithDefault("PT60S")
        Duration clockSkew();
    }
}
