package io.nebula.identity.account;

import io.nebula.identity.authentication.AuthException;
import io.nebula.identity.authentication.AuthFailure;
import io.nebula.identity.shared.EntityType;
import io.nebula.identity.shared.SecureTokens;
import io.nebula.identity.shared.TsidGenerator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Issues and redeems single-use account tokens.
 *
 * <p>Issuing a token invalidates the user's earlier tokens of the same purpose,
 * so only the most recent email link works.
 */
@ApplicationScoped
public class AccountTokenService {

    private static final Logger LOG = Logger.getLogger(AccountTokenService.class);
    private static final int TOKEN_BYTES = 32;

    @Inject
    AccountTokenRepository tokenRepository;

    /**
     * Issue a token for a user.
     *
     * @return the raw token, to be placed in an email link
     */
    @Transactional
    public String issue(String userId, AccountTokenPurpose purpose, Duration ttl) {
        Instant now = Instant.now();
        long superseded = tokenRepository.invalidateOutstanding(userId, purpose, now);

        String raw = SecureTokens.generate(TOKEN_BYTES);
        AccountToken token = new AccountToken();
        token.id = TsidGenerator.generate(EntityType.ACCOUNT_TOKEN);
        token.tokenHash = SecureTokens.sha256Hex(raw);
        token.userId = userId;
        token.purpose = purpose;
        token.createdAt = now;
        token.expiresAt = now.plus(ttl);
        tokenRepository.persist(token);

        LOG.debugf("Issued %s token %s for user %s (%d superseded)", purpose, token.id, userId, superseded);
        return raw;
    }

    /**
     * Look up a token without redeeming it.
     *
     * @return the token if it exists, has the purpose, and is neither used nor expired
     */
    public Optional<AccountToken> inspect(String raw, AccountTokenPurpose purpose) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        Instant now = Instant.now();
        return tokenRepository.findByTokenHash(SecureTokens.sha256Hex(raw))
            .filter(token -> token.isRedeemable(purpose, now));
    }

    /**
     * Redeem a token. Joins the caller's transaction, so the token stays
     * unused when the caller's work rolls back.
     *
     * @throws AuthException INVALID_ACCOUNT_TOKEN when the token is unknown, used, expired or for another purpose
     */
    @Transactional
    public AccountToken consume(String raw, AccountTokenPurpose purpose) {
        if (raw == null || raw.isBlank()) {
            throw new AuthException(AuthFailure.INVALID_ACCOUNT_TOKEN);
        }
        Instant now = Instant.now();
        AccountToken token = tokenRepository.findByTokenHashForUpdate(SecureTokens.sha256Hex(raw))
            .filter(found -> found.isRedeemable(purpose, now))
            .orElseThrow(() -> {
                LOG.infof("Rejected %s token %s", purpose, SecureTokens.prefix(raw));
                return new AuthException(AuthFailure.INVALID_ACCOUNT_TOKEN);
            });

        token.usedAt = now;
        tokenRepository.update(token);
        return token;
    }
}
