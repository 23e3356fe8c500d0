package io.nebula.identity.session.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for web_sessions table.
 */
@Entity
@Table(name = "web_sessions",
    indexes = {
        @Index(name = "idx_web_sessions_expires_at", columnList = "expires_at"),
        @Index(name = "idx_web_sessions_user_id", columnList = "user_id")
    })
public class WebSessionEntity {

    @Id
    @Column(name = "id", length = 64)
    public String id;

    @Column(name = "user_id", length = 17)
    public String userId;

    @Column(name = "oauth_state", length = 64)
    public String oauthState;

    @Column(name = "code_verifier", length = 128)
    public String codeVerifier;

    @Column(name = "code_challenge", length = 64)
    public String codeChallenge;

    @Column(name = "nonce", length = 64)
    public String nonce;

    @Column(name = "return_to", length = 2000)
    public String returnTo;

    @Column(name = "federation_started_at")
    public Instant federationStartedAt;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "last_seen_at")
    public Instant lastSeenAt;

    @Column(name = "expires_at", nullable = false)
    public Instant expiresAt;

    public WebSessionEntity() {
    }
}
