package io.nebula.identity.account;

import java.time.Instant;

/**
 * A single-use, expiring token mailed to a user.
 *
 * <p>Only the SHA-256 hash of the token is stored. The raw value exists in
 * the email link and nowhere else.
 */
public class AccountToken {

    public String id;

    public String tokenHash;

    public String userId;

    public AccountTokenPurpose purpose;

    public Instant expiresAt;

    /**
     * Set when the token is redeemed or superseded by a newer one.
     */
    public Instant usedAt;

    public Instant createdAt = Instant.now();

    public AccountToken() {
    }

    public boolean isUsed() {
        return usedAt != null;
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isRedeemable(AccountTokenPurpose expected, Instant now) {
        return purpose == expected && !isUsed() && !isExpired(now);
    }
}
