package io.nebula.identity.user.panache;

import io.nebula.identity.user.User;
import io.nebula.identity.user.UserRepository;
import io.nebula.identity.user.UserRole;
import io.nebula.identity.user.entity.UserEntity;
import io.nebula.identity.user.mapper.UserMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;

import java.util.List;
import java.util.Optional;

/**
 * Read-side repository for User entities.
 * Uses EntityManager directly to return domain objects without conflicts.
 */
@ApplicationScoped
public class UserReadRepository implements UserRepository {

    @Inject
    EntityManager em;

    @Inject
    UserWriteRepository writeRepo;

    @Override
    public Optional<User> findByIdOptional(String id) {
        if (id == null) {
            return Optional.empty();
        }
        UserEntity entity = em.find(UserEntity.class, id);
        return Optional.ofNullable(entity).map(UserMapper::toDomain);
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return findSingle("FROM UserEntity WHERE email = :value", email);
    }

    @Override
    public Optional<User> findByFederatedSubjectId(String federatedSubjectId) {
        return findSingle("FROM UserEntity WHERE federatedSubjectId = :value", federatedSubjectId);
    }

    @Override
    public Optional<User> findByUsername(String username) {
        return findSingle("FROM UserEntity WHERE username = :value", username);
    }

    @Override
    public List<User> findByOrganizationId(String organizationId) {
        return em.createQuery(
                "FROM UserEntity WHERE organizationId = :organizationId ORDER BY createdAt", UserEntity.class)
            .setParameter("organizationId", organizationId)
            .getResultList()
            .stream()
            .map(UserMapper::toDomain)
            .toList();
    }

    @Override
    public long countByOrganizationIdAndRole(String organizationId, UserRole role) {
        return em.createQuery(
                "SELECT COUNT(u) FROM UserEntity u WHERE u.organizationId = :organizationId AND u.role = :role",
                Long.class)
            .setParameter("organizationId", organizationId)
            .setParameter("role", role)
            .getSingleResult();
    }

    private Optional<User> findSingle(String query, String value) {
        if (value == null) {
            return Optional.empty();
        }
        var results = em.createQuery(query, UserEntity.class)
            .setParameter("value", value)
            .setMaxResults(1)
            .getResultList();
        return results.isEmpty() ? Optional.empty() : Optional.of(UserMapper.toDomain(results.get(0)));
    }

    // Write operations delegate to WriteRepository
    @Override
    public void persist(User user) {
        writeRepo.persistUser(user);
    }

    @Override
    public void update(User user) {
        writeRepo.updateUser(user);
    }
}
