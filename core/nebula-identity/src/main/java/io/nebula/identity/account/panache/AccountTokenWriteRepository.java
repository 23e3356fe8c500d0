package io.nebula.identity.account.panache;

import io.nebula.identity.account.AccountToken;
import io.nebula.identity.account.AccountTokenPurpose;
import io.nebula.identity.account.entity.AccountTokenEntity;
import io.nebula.identity.account.mapper.AccountTokenMapper;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;

import java.time.Instant;

/**
 * Write-side repository for AccountToken entities.
 */
@ApplicationScoped
@Transactional
public class AccountTokenWriteRepository implements PanacheRepositoryBase<AccountTokenEntity, String> {

    public void persistToken(AccountToken token) {
        if (token.createdAt == null) {
            token.createdAt = Instant.now();
        }
        persist(AccountTokenMapper.toEntity(token));
    }

    public void updateToken(AccountToken token) {
        AccountTokenEntity entity = findById(token.id);
        if (entity != null) {
            AccountTokenMapper.updateEntity(entity, token);
        }
    }

    public long markUsed(String userId, AccountTokenPurpose purpose, Instant now) {
        return update("usedAt = ?1 where userId = ?2 and purpose = ?3 and usedAt is null",
            now, userId, purpose);
    }

    public long deleteExpiredTokens(Instant now) {
        return delete("expiresAt <= ?1", now);
    }
}
