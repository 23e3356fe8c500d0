package io.nebula.identity.account.panache;

import io.nebula.identity.account.AccountToken;
import io.nebula.identity.account.AccountTokenPurpose;
import io.nebula.identity.account.AccountTokenRepository;
import io.nebula.identity.account.entity.AccountTokenEntity;
import io.nebula.identity.account.mapper.AccountTokenMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-side repository for AccountToken entities.
 * Uses EntityManager directly to return domain objects.
 */
@ApplicationScoped
public class AccountTokenReadRepository implements AccountTokenRepository {

    private static final String BY_HASH = "FROM AccountTokenEntity WHERE tokenHash = :tokenHash";

    @Inject
    EntityManager em;

    @Inject
    AccountTokenWriteRepository writeRepo;

    @Override
    public Optional<AccountToken> findByTokenHash(String tokenHash) {
        return first(em.createQuery(BY_HASH, AccountTokenEntity.class)
            .setParameter("tokenHash", tokenHash)
            .setMaxResults(1)
            .getResultList());
    }

    @Override
    public Optional<AccountToken> findByTokenHashForUpdate(String tokenHash) {
        return first(em.createQuery(BY_HASH, AccountTokenEntity.class)
            .setParameter("tokenHash", tokenHash)
            .setLockMode(LockModeType.PESSIMISTIC_WRITE)
            .setMaxResults(1)
            .getResultList());
    }

    private static Optional<AccountToken> first(List<AccountTokenEntity> results) {
        return results.isEmpty() ? Optional.empty() : Optional.of(AccountTokenMapper.toDomain(results.get(0)));
    }

    // Write operations delegate to WriteRepository
    @Override
    public void persist(AccountToken token) {
        writeRepo.persistToken(token);
    }

    @Override
    public void update(AccountToken token) {
        writeRepo.updateToken(token);
    }

    @Override
    public long invalidateOutstanding(String userId, AccountTokenPurpose purpose, Instant now) {
        return writeRepo.markUsed(userId, purpose, now);
    }

    @Override
    public long deleteExpired(Instant now) {
        return writeRepo.deleteExpiredTokens(now);
    }
}
