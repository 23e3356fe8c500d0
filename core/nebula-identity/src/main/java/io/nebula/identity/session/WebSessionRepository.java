package io.nebula.identity.session;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for WebSession entities.
 * Sessions live in the database so they survive restarts and are shared between instances.
 */
public interface WebSessionRepository {

    // Read operations
    Optional<WebSession> findActive(String sessionId);

    /**
     * Like {@link #findActive(String)} but holds a row lock until the transaction ends.
     */
    Optional<WebSession> findActiveForUpdate(String sessionId);

    // Write operations
    void persist(WebSession session);
    void update(WebSession session);
    void deleteSession(String sessionId);
    long deleteByUserId(String userId);
    long deleteExpired(Instant now);
}
