package io.nebula.identity.user.mapper;

import io.nebula.identity.user.User;
import io.nebula.identity.user.entity.UserEntity;

/**
 * Mapper for converting between User domain model and JPA entity.
 */
public final class UserMapper {

    private UserMapper() {
    }

    public static User toDomain(UserEntity entity) {
        if (entity == null) {
            return null;
        }

        User domain = new User();
        domain.id = entity.id;
        domain.email = entity.email;
        domain.username = entity.username;
        domain.passwordHash = entity.passwordHash;
        domain.displayName = entity.displayName;
        domain.role = entity.role;
        domain.organizationId = entity.organizationId;
        domain.federatedSubjectId = entity.federatedSubjectId;
        domain.federatedTenantId = entity.federatedTenantId;
        domain.authProvider = entity.authProvider;
        domain.emailVerified = entity.emailVerified;
        domain.lastLoginAt = entity.lastLoginAt;
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        return domain;
    }

    public static UserEntity toEntity(User domain) {
        if (domain == null) {
            return null;
        }

        UserEntity entity = new UserEntity();
        entity.id = domain.id;
        updateEntity(entity, domain);
        entity.createdAt = domain.createdAt;
        return entity;
    }

    /**
     * Copy mutable fields onto a managed entity. Id and creation time are left alone.
     */
    public static void updateEntity(UserEntity entity, User domain) {
        entity.email = domain.email;
        entity.username = domain.username;
        entity.passwordHash = domain.passwordHash;
        entity.displayName = domain.displayName;
        entity.role = domain.role;
        entity.organizationId = domain.organizationId;
        entity.federatedSubjectId = domain.federatedSubjectId;
        entity.federatedTenantId = domain.federatedTenantId;
        entity.authProvider = domain.authProvider;
        entity.emailVerified = domain.emailVerified;
        entity.lastLoginAt = domain.lastLoginAt;
        entity.updatedAt = domain.updatedAt;
    }
}
