package tech.policyhub.rbac.authorization;

import tech.policyhub.rbac.common.PolicyTransaction;

import java.util.Optional;

/**
 * Repository for {@link RoleMetadata}. Every call runs inside the given
 * transaction.
 */
public interface RoleMetadataRepository {

    Optional<RoleMetadata> findRoleMetadata(String roleEntityRef, PolicyTransaction tx);

    void createRoleMetadata(RoleMetadata metadata, PolicyTransaction tx);

    /**
     * Replace the record stored under {@code roleEntityRef} with {@code metadata}.
     *
     * @throws tech.policyhub.rbac.common.errors.RoleMetadataNotFoundException if no record exists
     */
    void updateRoleMetadata(RoleMetadata metadata, String roleEntityRef, PolicyTransaction tx);

    void removeRoleMetadata(String roleEntityRef, PolicyTransaction tx);
}
