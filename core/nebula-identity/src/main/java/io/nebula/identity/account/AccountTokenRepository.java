package io.nebula.identity.account;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository interface for AccountToken entities.
 */
public interface AccountTokenRepository {

    // Read operations
    Optional<AccountToken> findByTokenHash(String tokenHash);

    /**
     * Like {@link #findByTokenHash(String)} but holds a row lock until the transaction ends.
     */
    Optional<AccountToken> findByTokenHashForUpdate(String tokenHash);

    // Write operations
    void persist(AccountToken token);
    void update(AccountToken token);

    /**
     * Mark every unused token of a user and purpose as used.
     *
     * @return number of tokens invalidated
     */
    long invalidateOutstanding(String userId, AccountTokenPurpose purpose, Instant now);

    long deleteExpired(Instant now);
}
