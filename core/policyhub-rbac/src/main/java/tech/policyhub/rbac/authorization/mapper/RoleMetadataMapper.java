package tech.policyhub.rbac.authorization.mapper;

import tech.policyhub.rbac.authorization.RoleMetadata;
import tech.policyhub.rbac.authorization.RoleSource;
import tech.policyhub.rbac.authorization.entity.RoleMetadataEntity;

/**
 * Mapper for converting between RoleMetadata domain model and JPA entity.
 */
public final class RoleMetadataMapper {

    private RoleMetadataMapper() {
    }

    public static RoleMetadata toDomain(RoleMetadataEntity entity) {
        if (entity == null) {
            return null;
        }

        RoleMetadata domain = new RoleMetadata();
        domain.id = entity.id;
        domain.roleEntityRef = entity.roleEntityRef;
        domain.source = RoleSource.fromValue(entity.source);
        domain.author = entity.author;
        domain.modifiedBy = entity.modifiedBy;
        domain.description = entity.description;
        domain.owner = entity.owner;
        domain.createdAt = entity.createdAt;
        domain.lastModified = entity.lastModified;
        return domain;
    }

    public static RoleMetadataEntity toEntity(RoleMetadata domain) {
        if (domain == null) {
            return null;
        }

        RoleMetadataEntity entity = new RoleMetadataEntity();
        entity.id = domain.id;
        entity.createdAt = domain.createdAt;
        entity.author = domain.author;
        updateEntity(entity, domain);
        return entity;
    }

    /**
     * Copy the mutable fields. Id, author and creation time are never changed.
     */
    public static void updateEntity(RoleMetadataEntity entity, RoleMetadata domain) {
        entity.roleEntityRef = domain.roleEntityRef;
        entity.source = domain.source != null ? domain.source.value() : RoleSource.LEGACY.value();
        entity.modifiedBy = domain.modifiedBy;
        entity.description = domain.description;
        entity.owner = domain.owner;
        entity.lastModified = domain.lastModified;
    }
}
