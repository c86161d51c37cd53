package tech.policyhub.rbac.authorization.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for role_metadata table.
 */
@Entity
@Table(name = "role_metadata")
public class RoleMetadataEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "role_entity_ref", nullable = false, unique = true)
    public String roleEntityRef;

    @Column(name = "source", nullable = false, length = 20)
    public String source;

    @Column(name = "author")
    public String author;

    @Column(name = "modified_by")
    public String modifiedBy;

    @Column(name = "description", columnDefinition = "TEXT")
    public String description;

    @Column(name = "owner")
    public String owner;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "last_modified", nullable = false)
    public Instant lastModified;

    public RoleMetadataEntity() {
    }
}
