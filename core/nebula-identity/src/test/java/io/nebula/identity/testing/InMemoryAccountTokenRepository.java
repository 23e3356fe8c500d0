package io.nebula.identity.testing;

import io.nebula.identity.account.AccountToken;
import io.nebula.identity.account.AccountTokenPurpose;
import io.nebula.identity.account.AccountTokenRepository;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory AccountTokenRepository. Row locking is not modelled.
 */
public class InMemoryAccountTokenRepository implements AccountTokenRepository {

    private final Map<String, AccountToken> tokens = new ConcurrentHashMap<>();

    @Override
    public Optional<AccountToken> findByTokenHash(String tokenHash) {
        return tokens.values().stream().filter(t -> t.tokenHash.equals(tokenHash)).findFirst();
    }

    @Override
    public Optional<AccountToken> findByTokenHashForUpdate(String tokenHash) {
        return findByTokenHash(tokenHash);
    }

    @Override
    public void persist(AccountToken token) {
        if (findByTokenHash(token.tokenHash).isPresent()) {
            throw new IllegalStateException("duplicate token hash");
        }
        tokens.put(token.id, token);
    }

    @Override
    public void update(AccountToken token) {
        tokens.put(token.id, token);
    }

    @Override
    public long invalidateOutstanding(String userId, AccountTokenPurpose purpose, Instant now) {
        List<AccountToken> outstanding = tokens.values().stream()
            .filter(t -> t.userId.equals(userId) && t.purpose == purpose && !t.isUsed())
            .collect(Collectors.toList());
        outstanding.forEach(t -> t.usedAt = now);
        return outstanding.size();
    }

    @Override
    public long deleteExpired(Instant now) {
        long before = tokens.size();
        tokens.values().removeIf(t -> t.isExpired(now));
        return before - tokens.size();
    }

    public List<AccountToken> all() {
        return List.copyOf(tokens.values());
    }
}
