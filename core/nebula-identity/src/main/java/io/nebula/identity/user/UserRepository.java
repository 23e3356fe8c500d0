package io.nebula.identity.user;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for User entities.
 */
public interface UserRepository {

    // Read operations
    Optional<User> findByIdOptional(String id);
    Optional<User> findByEmail(String email);
    Optional<User> findByFederatedSubjectId(String federatedSubjectId);
    Optional<User> findByUsername(String username);
    List<User> findByOrganizationId(String organizationId);
    long countByOrganizationIdAndRole(String organizationId, UserRole role);

    // Write operations
    void persist(User user);
    void update(User user);
}
