package tech.policyhub.rbac.authorization;

import java.time.Instant;

/**
 * Audit and lifecycle record for a role, keyed by its entity reference
 * (e.g. "role:default/developers").
 *
 * A record exists while at least one grouping policy targets the role.
 * The administrative role keeps its record even with no members left.
 */
public class RoleMetadata {

    public String id;

    /**
     * Role entity reference, "role:{namespace}/{name}".
     */
    public String roleEntityRef;

    /**
     * Where the role definition came from.
     */
    public RoleSource source = RoleSource.REST;

    /**
     * Principal that created the role.
     */
    public String author;

    /**
     * Principal that last changed the role.
     */
    public String modifiedBy;

    public String description;

    /**
     * Entity reference of the role's owner (user or group).
     */
    public String owner;

    public Instant createdAt;

    public Instant lastModified;

    public RoleMetadata() {
    }

    public RoleMetadata(String roleEntityRef, RoleSource source, String modifiedBy) {
        this.roleEntityRef = roleEntityRef;
        this.source = source;
        this.modifiedBy = modifiedBy;
    }

    public RoleMetadata copy() {
        RoleMetadata copy = new RoleMetadata();
        copy.id = id;
        copy.roleEntityRef = roleEntityRef;
        copy.source = source;
        copy.author = author;
        copy.modifiedBy = modifiedBy;
        copy.description = description;
        copy.owner = owner;
        copy.createdAt = createdAt;
        copy.lastModified = lastModified;
        return copy;
    }
}
