package io.nebula.identity.session;

import java.time.Duration;
import java.time.Instant;

/**
 * One-shot state of a federated login in progress: CSRF state, PKCE pair,
 * nonce and where to go afterwards.
 */
public record FederationContext(
    String state,
    String codeVerifier,
    String codeChallenge,
    String nonce,
    String returnTo,
    Instant startedAt
) {

    public boolean isExpired(Instant now, Duration ttl) {
        return startedAt == null || startedAt.plus(ttl).isBefore(now);
    }
}
