package io.nebula.identity.organization.mapper;

import io.nebula.identity.organization.Organization;
import io.nebula.identity.organization.entity.OrganizationEntity;

/**
 * Mapper for converting between Organization domain model and JPA entity.
 */
public final class OrganizationMapper {

    private OrganizationMapper() {
    }

    public static Organization toDomain(OrganizationEntity entity) {
        if (entity == null) {
            return null;
        }

        Organization domain = new Organization();
        domain.id = entity.id;
        domain.name = entity.name;
        domain.slug = entity.slug;
        domain.domain = entity.domain;
        domain.federatedTenantId = entity.federatedTenantId;
        domain.inviteOnly = entity.inviteOnly;
        domain.ssoEnabled = entity.ssoEnabled;
        domain.ssoProvider = entity.ssoProvider;
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        return domain;
    }

    public static OrganizationEntity toEntity(Organization domain) {
        if (domain == null) {
            return null;
        }

        OrganizationEntity entity = new OrganizationEntity();
        entity.id = domain.id;
        entity.createdAt = domain.createdAt;
        updateEntity(entity, domain);
        return entity;
    }

    public static void updateEntity(OrganizationEntity entity, Organization domain) {
        entity.name = domain.name;
        entity.slug = domain.slug;
        entity.domain = domain.domain;
        entity.federatedTenantId = domain.federatedTenantId;
        entity.inviteOnly = domain.inviteOnly;
        entity.ssoEnabled = domain.ssoEnabled;
        entity.ssoProvider = domain.ssoProvider;
        entity.updatedAt = domain.updatedAt;
    }
}
