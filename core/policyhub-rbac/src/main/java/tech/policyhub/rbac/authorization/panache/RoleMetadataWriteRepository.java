package tech.policyhub.rbac.authorization.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.policyhub.rbac.authorization.RoleMetadata;
import tech.policyhub.rbac.authorization.entity.RoleMetadataEntity;
import tech.policyhub.rbac.authorization.mapper.RoleMetadataMapper;
import tech.policyhub.rbac.shared.EntityType;
import tech.policyhub.rbac.shared.TsidGenerator;

import java.time.Instant;

/**
 * Write-side repository for RoleMetadata entities.
 */
@ApplicationScoped
public class RoleMetadataWriteRepository implements PanacheRepositoryBase<RoleMetadataEntity, String> {

    /**
     * Persist a new record, assigning an id and timestamps where missing.
     */
    public void persistMetadata(RoleMetadata metadata) {
        if (metadata.id == null) {
            metadata.id = TsidGenerator.generate(EntityType.ROLE_METADATA);
        }
        if (metadata.createdAt == null) {
            metadata.createdAt = Instant.now();
        }
        if (metadata.lastModified == null) {
            metadata.lastModified = metadata.createdAt;
        }
        persist(RoleMetadataMapper.toEntity(metadata));
    }

    /**
     * Update the record stored under {@code roleEntityRef}.
     *
     * @return false if no record exists
     */
    public boolean updateMetadata(RoleMetadata metadata, String roleEntityRef) {
        RoleMetadataEntity entity = find("roleEntityRef", roleEntityRef).firstResult();
        if (entity == null) {
            return false;
        }
        if (metadata.lastModified == null) {
            metadata.lastModified = Instant.now();
        }
        RoleMetadataMapper.updateEntity(entity, metadata);
        return true;
    }

    public long deleteByRoleEntityRef(String roleEntityRef) {
        return delete("roleEntityRef", roleEntityRef);
    }
}
