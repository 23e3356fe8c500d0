package io.nebula.identity.authentication.oidc;

import io.nebula.identity.authentication.AuthConfig;
import io.nebula.identity.authentication.AuthException;
import io.nebula.identity.authentication.AuthFailure;
import io.nebula.identity.session.FederationContext;
import io.nebula.identity.session.SessionAuthority;
import io.nebula.identity.session.WebSession;
import io.nebula.identity.shared.SecureTokens;
import io.nebula.identity.tenant.JitProvisioner;
import io.nebula.identity.user.User;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Optional;

/**
 * Federated login state machine.
 *
 * <pre>
 * beginLogin:    PKCE pair + state + nonce -> stored in session (committed) -> authorization URL
 * completeLogin: take context (one-shot) -> provider error? -> state check -> code exchange
 *                -> ID token -> JIT provisioning -> new authenticated session
 * </pre>
 *
 * No step is retried. Every failure is an {@link AuthException}; the stored
 * context is consumed before anything else, so a callback can never be replayed.
 */
@ApplicationScoped
public class FederatedLoginService {

    private static final Logger LOG = Logger.getLogger(FederatedLoginService.class);

    public static final String CALLBACK_PATH = "/auth/sso/callback";
    public static final String LOGOUT_COMPLETE_PATH = "/auth/sso/logout-complete";
    public static final String DEFAULT_LANDING = "/";

    private static final int STATE_BYTES = 32;
    private static final int NONCE_BYTES = 32;
    private static final int MAX_RETURN_TO_LENGTH = 2000;

    @Inject
    AuthConfig authConfig;

    @Inject
    OidcProviderClient providerClient;

    @Inject
    PkceService pkceService;

    @Inject
    IdTokenValidator idTokenValidator;

    @Inject
    JitProvisioner jitProvisioner;

    @Inject
    SessionAuthority sessionAuthority;

    /**
     * Provider credentials are present.
     */
    public boolean isConfigured() {
        return providerClient.isConfigured();
    }

    /**
     * Federation is configured and switched on.
     */
    public boolean isEnabled() {
        return authConfig.oidc().enabled() && providerClient.isConfigured();
    }

    /**
     * Start a federated login.
     *
     * @param sessionId session the browser already has, may be null
     * @param returnTo  relative path to land on afterwards, ignored unless it is a local path
     * @param baseUrl   public base URL of this service
     * @throws AuthException SSO_NOT_CONFIGURED when federation is unavailable
     */
    public LoginRedirect beginLogin(String sessionId, String returnTo, String baseUrl) {
        if (!isEnabled()) {
            throw new AuthException(AuthFailure.SSO_NOT_CONFIGURED);
        }

        String codeVerifier = pkceService.generateCodeVerifier();
        String codeChallenge = pkceService.generateCodeChallenge(codeVerifier);
        FederationContext context = new FederationContext(
            SecureTokens.generate(STATE_BYTES),
            codeVerifier,
            codeChallenge,
            SecureTokens.generate(NONCE_BYTES),
            safeReturnTo(returnTo),
            Instant.now()
        );

        // Committed before the redirect is built
        WebSession session = sessionAuthority.beginFederation(sessionId, context);

        String authorizationUrl = providerClient.authorizationUrl(new OidcProviderClient.AuthorizationRequest(
            callbackUrl(baseUrl),
            context.state(),
            context.nonce(),
            context.codeChallenge()
        ));

        LOG.debugf("Federated login started for session %s", SecureTokens.prefix(session.id));
        return new LoginRedirect(session, authorizationUrl);
    }

    /**
     * Finish a federated login from the provider callback.
     *
     * @throws AuthException FEDERATION_DENIED, SECURITY_VALIDATION_FAILED, FEDERATION_UNAVAILABLE,
     *                       or any tenant/provisioning failure
     */
    public CompletedLogin completeLogin(String sessionId, CallbackParameters callback, String baseUrl) {
        Optional<FederationContext> stored = sessionAuthority.takeFederationContext(sessionId);

        if (callback.error() != null) {
            LOG.warnf("Identity provider returned error: %s - %s", callback.error(), callback.errorDescription());
            throw new AuthException(AuthFailure.FEDERATION_DENIED, callback.error());
        }

        if (stored.isEmpty()) {
            LOG.warnf("Callback rejected: no login in progress for session %s (state %s)",
                SecureTokens.prefix(sessionId), SecureTokens.prefix(callback.state()));
            throw new AuthException(AuthFailure.SECURITY_VALIDATION_FAILED, "no federation context");
        }

        FederationContext context = stored.get();
        if (!SecureTokens.constantTimeEquals(context.state(), callback.state())) {
            LOG.warnf("Callback rejected: state mismatch for session %s (expected %s, received %s)",
                SecureTokens.prefix(sessionId), SecureTokens.prefix(context.state()),
                SecureTokens.prefix(callback.state()));
            throw new AuthException(AuthFailure.SECURITY_VALIDATION_FAILED, "state mismatch");
        }

        if (context.isExpired(Instant.now(), authConfig.oidc().stateTtl())) {
            LOG.warnf("Callback rejected: login for session %s started at %s has expired",
                SecureTokens.prefix(sessionId), context.startedAt());
            throw new AuthException(AuthFailure.SECURITY_VALIDATION_FAILED, "federation context expired");
        }

        if (callback.code() == null || callback.code().isBlank()) {
            throw new AuthException(AuthFailure.FEDERATION_DENIED, "no authorization code");
        }

        OidcProviderClient.TokenSet tokens;
        try {
            tokens = providerClient.exchangeCode(callback.code(), context.codeVerifier(), callbackUrl(baseUrl));
        } catch (FederationException e) {
            LOG.errorf("Code exchange failed (retryable: %s): %s", e.isRetryable(), e.getMessage());
            AuthFailure failure = e.isRetryable() ? AuthFailure.FEDERATION_UNAVAILABLE : AuthFailure.FEDERATION_DENIED;
            throw new AuthException(failure, e.getMessage(), e);
        }

        FederatedIdentity identity = idTokenValidator.validate(tokens.idToken(), context.nonce());
        User user = jitProvisioner.provision(identity);
        WebSession session = sessionAuthority.establish(sessionId, user.id);

        LOG.infof("Federated login succeeded for user %s", user.id);
        String redirectTo = context.returnTo() != null ? context.returnTo() : DEFAULT_LANDING;
        return new CompletedLogin(session, user, redirectTo);
    }

    /**
     * End the local session and build the provider logout URL.
     *
     * @return provider logout URL, or the local logout-complete page when the provider has none
     */
    public String logout(String sessionId, String baseUrl) {
        sessionAuthority.destroy(sessionId);
        String postLogout = baseUrl + LOGOUT_COMPLETE_PATH;
        return providerClient.endSessionUrl(postLogout).orElse(postLogout);
    }

    public static String callbackUrl(String baseUrl) {
        return baseUrl + CALLBACK_PATH;
    }

    /**
     * Accept only local absolute paths, so the post-login redirect cannot leave the site.
     */
    static String safeReturnTo(String returnTo) {
        if (returnTo == null || returnTo.isBlank() || returnTo.length() > MAX_RETURN_TO_LENGTH) {
            return null;
        }
        if (!returnTo.startsWith("/") || returnTo.startsWith("//") || returnTo.contains("\\")) {
            return null;
        }
        return returnTo;
    }

    public record CallbackParameters(String code, String state, String error, String errorDescription) {}

    public record LoginRedirect(WebSession session, String authorizationUrl) {}

    public record CompletedLogin(WebSession session, User user, String redirectTo) {}
}
