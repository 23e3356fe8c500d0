package io.nebula.identity.account.entity;

import io.nebula.identity.account.AccountTokenPurpose;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;

/**
 * JPA entity for account_tokens table.
 */
@Entity
@Table(name = "account_tokens",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_account_tokens_token_hash", columnNames = "token_hash")
    },
    indexes = {
        @Index(name = "idx_account_tokens_user_purpose", columnList = "user_id, purpose"),
        @Index(name = "idx_account_tokens_expires_at", columnList = "expires_at")
    })
public class AccountTokenEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "token_hash", nullable = false, length = 64)
    public String tokenHash;

    @Column(name = "user_id", nullable = false, length = 17)
    public String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "purpose", nullable = false, length = 30)
    public AccountTokenPurpose purpose;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    @Column(name = "used_at")
    public Instant usedAt;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public AccountTokenEntity() {
    }
}
