package io.nebula.identity.session.mapper;

import io.nebula.identity.session.WebSession;
import io.nebula.identity.session.entity.WebSessionEntity;

/**
 * Mapper for converting between WebSession domain model and JPA entity.
 */
public final class WebSessionMapper {

    private WebSessionMapper() {
    }

    public static WebSession toDomain(WebSessionEntity entity) {
        if (entity == null) {
            return null;
        }

        WebSession domain = new WebSession();
        domain.id = entity.id;
        domain.userId = entity.userId;
        domain.oauthState = entity.oauthState;
        domain.codeVerifier = entity.codeVerifier;
        domain.codeChallenge = entity.codeChallenge;
        domain.nonce = entity.nonce;
        domain.returnTo = entity.returnTo;
        domain.federationStartedAt = entity.federationStartedAt;
        domain.createdAt = entity.createdAt;
        domain.lastSeenAt = entity.lastSeenAt;
        domain.expiresAt = entity.expiresAt;
        return domain;
    }

    public static WebSessionEntity toEntity(WebSession domain) {
        if (domain == null) {
            return null;
        }

        WebSessionEntity entity = new WebSessionEntity();
        entity.id = domain.id;
        entity.createdAt = domain.createdAt;
        updateEntity(entity, domain);
        return entity;
    }

    public static void updateEntity(WebSessionEntity entity, WebSession domain) {
        entity.userId = domain.userId;
        entity.oauthState = domain.oauthState;
        entity.codeVerifier = domain.codeVerifier;
        entity.codeChallenge = domain.codeChallenge;
        entity.nonce = domain.nonce;
        entity.returnTo = domain.returnTo;
        entity.federationStartedAt = domain.federationStartedAt;
        entity.lastSeenAt = domain.lastSeenAt;
        entity.expiresAt = domain.expiresAt;
    }
}
