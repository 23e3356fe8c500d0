package io.nebula.identity.session;

import java.time.Instant;

/**
 * Server-side session keyed by an unguessable id carried in a signed cookie.
 *
 * <p>Anonymous until {@link #userId} is set by {@link SessionAuthority#establish}.
 * The federation fields are write-once-read-once and are cleared when the
 * callback consumes them.
 */
public class WebSession {

    public String id;

    public String userId;

    // Federation context
    public String oauthState;
    public String codeVerifier;
    public String codeChallenge;
    public String nonce;
    public String returnTo;
    public Instant federationStartedAt;

    public Instant createdAt;

    public Instant lastSeenAt;

    public Instant expiresAt;

    public WebSession() {
    }

    public static WebSession create(String id, Instant now, Instant expiresAt) {
        WebSession session = new WebSession();
        session.id = id;
        session.createdAt = now;
        session.lastSeenAt = now;
        session.expiresAt = expiresAt;
        return session;
    }

    public boolean isAuthenticated() {
        return userId != null;
    }

    public boolean isExpired(Instant now) {
        return expiresAt == null || !expiresAt.isAfter(now);
    }

    public boolean hasFederationContext() {
        return oauthState != null;
    }

    public FederationContext federationContext() {
        return new FederationContext(oauthState, codeVerifier, codeChallenge, nonce, returnTo, federationStartedAt);
    }

    /**
     * Store a new federation context, replacing any abandoned earlier attempt.
     */
    public void storeFederationContext(FederationContext context) {
        this.oauthState = context.state();
        this.codeVerifier = context.codeVerifier();
        this.codeChallenge = context.codeChallenge();
        this.nonce = context.nonce();
        this.returnTo = context.returnTo();
        this.federationStartedAt = context.startedAt();
    }

    public void clearFederationContext() {
        this.oauthState = null;
        this.codeVerifier = null;
        this.codeChallenge = null;
        this.nonce = null;
        this.returnTo = null;
        this.federationStartedAt = null;
    }
}
