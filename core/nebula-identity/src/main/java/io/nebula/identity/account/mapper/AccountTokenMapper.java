package io.nebula.identity.account.mapper;

import io.nebula.identity.account.AccountToken;
import io.nebula.identity.account.entity.AccountTokenEntity;

/**
 * Mapper for converting between AccountToken domain model and JPA entity.
 */
public final class AccountTokenMapper {

    private AccountTokenMapper() {
    }

    public static AccountToken toDomain(AccountTokenEntity entity) {
        if (entity == null) {
            return null;
        }

        AccountToken domain = new AccountToken();
        domain.id = entity.id;
        domain.tokenHash = entity.tokenHash;
        domain.userId = entity.userId;
        domain.purpose = entity.purpose;
        domain.expiresAt = entity.expiresAt;
        domain.usedAt = entity.usedAt;
        domain.createdAt = entity.createdAt;
        return domain;
    }

    public static AccountTokenEntity toEntity(AccountToken domain) {
        if (domain == null) {
            return null;
        }

        AccountTokenEntity entity = new AccountTokenEntity();
        entity.id = domain.id;
        entity.tokenHash = domain.tokenHash;
        entity.userId = domain.userId;
        entity.purpose = domain.purpose;
        entity.createdAt = domain.createdAt;
        updateEntity(entity, domain);
        return entity;
    }

    public static void updateEntity(AccountTokenEntity entity, AccountToken domain) {
        entity.expiresAt = domain.expiresAt;
        entity.usedAt = domain.usedAt;
    }
}
