package tech.policyhub.rbac.authorization.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceException;
import org.jboss.logging.Logger;
import tech.policyhub.rbac.authorization.RoleMetadata;
import tech.policyhub.rbac.authorization.RoleMetadataRepository;
import tech.policyhub.rbac.authorization.entity.RoleMetadataEntity;
import tech.policyhub.rbac.authorization.mapper.RoleMetadataMapper;
import tech.policyhub.rbac.common.PolicyTransaction;
import tech.policyhub.rbac.common.errors.PolicyStoreException;
import tech.policyhub.rbac.common.errors.RoleMetadataNotFoundException;

import java.util.Optional;

/**
 * Read-side repository for RoleMetadata entities.
 * Uses EntityManager directly for reads and delegates writes to {@link RoleMetadataWriteRepository}.
 */
@ApplicationScoped
public class PanacheRoleMetadataRepository implements RoleMetadataRepository {

    private static final Logger LOG = Logger.getLogger(PanacheRoleMetadataRepository.class);

    @Inject
    EntityManager em;

    @Inject
    RoleMetadataWriteRepository writeRepo;

    @Override
    public Optional<RoleMetadata> findRoleMetadata(String roleEntityRef, PolicyTransaction tx) {
        requireActive(tx);
        try {
            var results = em.createQuery(
                    "FROM RoleMetadataEntity WHERE roleEntityRef = :ref", RoleMetadataEntity.class)
                .setParameter("ref", roleEntityRef)
                .getResultList();
            return results.isEmpty() ? Optional.empty() : Optional.of(RoleMetadataMapper.toDomain(results.get(0)));
        } catch (PersistenceException e) {
            throw new PolicyStoreException("Failed to read metadata of role " + roleEntityRef, e);
        }
    }

    @Override
    public void createRoleMetadata(RoleMetadata metadata, PolicyTransaction tx) {
        requireActive(tx);
        try {
            writeRepo.persistMetadata(metadata);
            LOG.debugf("Created metadata %s for role %s", metadata.id, metadata.roleEntityRef);
        } catch (PersistenceException e) {
            throw new PolicyStoreException("Failed to create metadata of role " + metadata.roleEntityRef, e);
        }
    }

    @Override
    public void updateRoleMetadata(RoleMetadata metadata, String roleEntityRef, PolicyTransaction tx) {
        requireActive(tx);
        boolean updated;
        try {
            updated = writeRepo.updateMetadata(metadata, roleEntityRef);
        } catch (PersistenceException e) {
            throw new PolicyStoreException("Failed to update metadata of role " + roleEntityRef, e);
        }
        if (!updated) {
            throw new RoleMetadataNotFoundException(roleEntityRef);
        }
    }

    @Override
    public void removeRoleMetadata(String roleEntityRef, PolicyTransaction tx) {
        requireActive(tx);
        try {
            writeRepo.deleteByRoleEntityRef(roleEntityRef);
        } catch (PersistenceException e) {
            throw new PolicyStoreException("Failed to remove metadata of role " + roleEntityRef, e);
        }
    }

    private static void requireActive(PolicyTransaction tx) {
        if (tx == null || !tx.isActive()) {
            throw new IllegalStateException("Role metadata access requires an active transaction");
        }
    }
}
