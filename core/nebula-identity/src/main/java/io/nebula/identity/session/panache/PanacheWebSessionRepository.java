package io.nebula.identity.session.panache;

import io.nebula.identity.session.WebSession;
import io.nebula.identity.session.WebSessionRepository;
import io.nebula.identity.session.entity.WebSessionEntity;
import io.nebula.identity.session.mapper.WebSessionMapper;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.LockModeType;

import java.time.Instant;
import java.util.Optional;

/**
 * Panache-based implementation of WebSessionRepository.
 * Callers own the transaction.
 */
@ApplicationScoped
public class PanacheWebSessionRepository
    implements WebSessionRepository, PanacheRepositoryBase<WebSessionEntity, String> {

    @Override
    public Optional<WebSession> findActive(String sessionId) {
        return find("id = ?1 and expiresAt > ?2", sessionId, Instant.now())
            .firstResultOptional()
            .map(WebSessionMapper::toDomain);
    }

    @Override
    public Optional<WebSession> findActiveForUpdate(String sessionId) {
        return find("id = ?1 and expiresAt > ?2", sessionId, Instant.now())
            .withLock(LockModeType.PESSIMISTIC_WRITE)
            .firstResultOptional()
            .map(WebSessionMapper::toDomain);
    }

    @Override
    public void persist(WebSession session) {
        persist(WebSessionMapper.toEntity(session));
    }

    @Override
    public void update(WebSession session) {
        WebSessionEntity entity = findById(session.id);
        if (entity != null) {
            WebSessionMapper.updateEntity(entity, session);
        }
    }

    @Override
    public void deleteSession(String sessionId) {
        deleteById(sessionId);
    }

    @Override
    public long deleteByUserId(String userId) {
        return delete("userId", userId);
    }

    @Override
    public long deleteExpired(Instant now) {
        return delete("expiresAt <= ?1", now);
    }
}
