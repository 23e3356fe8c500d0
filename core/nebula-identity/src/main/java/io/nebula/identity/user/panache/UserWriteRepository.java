package io.nebula.identity.user.panache;

import io.nebula.identity.user.User;
import io.nebula.identity.user.entity.UserEntity;
import io.nebula.identity.user.mapper.UserMapper;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;

import java.time.Instant;

/**
 * Write-side repository for User entities.
 * Extends PanacheRepositoryBase for efficient entity persistence.
 */
@ApplicationScoped
@Transactional
public class UserWriteRepository implements PanacheRepositoryBase<UserEntity, String> {

    /**
     * Persist a new user.
     */
    public void persistUser(User user) {
        if (user.createdAt == null) {
            user.createdAt = Instant.now();
        }
        user.updatedAt = Instant.now();
        persist(UserMapper.toEntity(user));
    }

    /**
     * Update an existing user.
     */
    public void updateUser(User user) {
        user.updatedAt = Instant.now();
        UserEntity entity = findById(user.id);
        if (entity != null) {
            UserMapper.updateEntity(entity, user);
        }
    }
}
