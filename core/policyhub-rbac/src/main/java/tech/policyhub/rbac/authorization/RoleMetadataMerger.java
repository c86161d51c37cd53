package tech.policyhub.rbac.authorization;

import java.time.Instant;

/**
 * Merges incoming role metadata into a stored record.
 */
public final class RoleMetadataMerger {

    private RoleMetadataMerger() {
    }

    public static RoleMetadata merge(RoleMetadata current, RoleMetadata incoming) {
        return merge(current, incoming, Instant.now());
    }

    /**
     * Identity, source, author and creation time come from {@code current}.
     * Modification fields come from {@code incoming}. Description and owner
     * fall back to {@code current} when {@code incoming} leaves them unset.
     */
    public static RoleMetadata merge(RoleMetadata current, RoleMetadata incoming, Instant now) {
        RoleMetadata merged = current.copy();
        merged.roleEntityRef = incoming.roleEntityRef;
        merged.modifiedBy = incoming.modifiedBy;
        merged.lastModified = incoming.lastModified != null ? incoming.lastModified : now;
        merged.description = incoming.description != null ? incoming.description : current.description;
        merged.owner = incoming.owner != null ? incoming.owner : current.owner;
        return merged;
    }
}
