package io.nebula.identity.session;

import io.nebula.identity.authentication.AuthConfig;
import io.nebula.identity.shared.SecureTokens;
import io.nebula.identity.user.User;
import io.nebula.identity.user.UserRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * The only component that marks a session as authenticated.
 *
 * <p>A session stores the user id and nothing else about the user. Every
 * {@link #current(String)} re-reads the user, so role and organization changes
 * apply on the next request. Destroying a session deletes its row, so a cookie
 * kept by the client no longer resolves.
 */
@ApplicationScoped
public class SessionAuthority {

    private static final Logger LOG = Logger.getLogger(SessionAuthority.class);
    private static final int SESSION_ID_BYTES = 32;

    @Inject
    WebSessionRepository sessionRepository;

    @Inject
    UserRepository userRepository;

    @Inject
    AuthConfig authConfig;

    /**
     * Establish an authenticated session for a user.
     */
    @Transactional
    public WebSession establish(String userId) {
        return establish(null, userId);
    }

    /**
     * Establish an authenticated session, discarding the caller's previous session.
     * The session id always changes on login.
     *
     * @param previousSessionId session the request arrived with, may be null
     * @param userId            authenticated user
     */
    @Transactional
    public WebSession establish(String previousSessionId, String userId) {
        Objects.requireNonNull(userId, "userId");

        if (previousSessionId != null) {
            sessionRepository.deleteSession(previousSessionId);
        }

        Instant now = Instant.now();
        WebSession session = WebSession.create(
            SecureTokens.generate(SESSION_ID_BYTES),
            now,
            now.plus(authConfig.session().maxAge())
        );
        session.userId = userId;
        sessionRepository.persist(session);

        LOG.debugf("Session %s established for user %s", SecureTokens.prefix(session.id), userId);
        return session;
    }

    /**
     * Resolve the user of a session.
     *
     * @return the current user record, or empty for unknown, expired or anonymous sessions
     */
    @Transactional
    public Optional<User> current(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }

        Optional<WebSession> found = sessionRepository.findActive(sessionId);
        if (found.isEmpty() || !found.get().isAuthenticated()) {
            return Optional.empty();
        }

        WebSession session = found.get();
        Optional<User> user = userRepository.findByIdOptional(session.userId);
        if (user.isEmpty()) {
            LOG.warnf("Session %s refers to missing user %s", SecureTokens.prefix(sessionId), session.userId);
            return Optional.empty();
        }

        Instant now = Instant.now();
        if (session.lastSeenAt == null
                || session.lastSeenAt.plus(authConfig.session().touchInterval()).isBefore(now)) {
            session.lastSeenAt = now;
            sessionRepository.update(session);
        }

        return user;
    }

    /**
     * Delete a session server-side.
     */
    @Transactional
    public void destroy(String sessionId) {
        if (sessionId == null) {
            return;
        }
        sessionRepository.deleteSession(sessionId);
        LOG.debugf("Session %s destroyed", SecureTokens.prefix(sessionId));
    }

    /**
     * Delete every session of a user, signing them out on all devices.
     *
     * @return number of sessions deleted
     */
    @Transactional
    public long revokeAll(String userId) {
        long deleted = sessionRepository.deleteByUserId(userId);
        LOG.debugf("Revoked %d sessions of user %s", deleted, userId);
        return deleted;
    }

    /**
     * Store a federation context, creating an anonymous session when the caller has none.
     * Commits before returning, so the redirect to the provider is only issued
     * once the context is durable.
     *
     * @return the session now holding the context
     */
    @Transactional
    public WebSession beginFederation(String sessionId, FederationContext context) {
        Instant now = Instant.now();
        WebSession session = sessionId == null
            ? null
            : sessionRepository.findActive(sessionId).orElse(null);

        if (session == null) {
            session = WebSession.create(
                SecureTokens.generate(SESSION_ID_BYTES),
                now,
                now.plus(authConfig.oidc().stateTtl())
            );
            session.storeFederationContext(context);
            sessionRepository.persist(session);
        } else {
            session.storeFederationContext(context);
            if (!session.isAuthenticated()) {
                session.expiresAt = now.plus(authConfig.oidc().stateTtl());
            }
            sessionRepository.update(session);
        }

        return session;
    }

    /**
     * Read and erase the federation context of a session, committed on its own.
     * A second call for the same session returns empty.
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public Optional<FederationContext> takeFederationContext(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }

        Optional<WebSession> found = sessionRepository.findActiveForUpdate(sessionId);
        if (found.isEmpty() || !found.get().hasFederationContext()) {
            return Optional.empty();
        }

        WebSession session = found.get();
        FederationContext context = session.federationContext();
        session.clearFederationContext();
        sessionRepository.update(session);
        return Optional.of(context);
    }
}
