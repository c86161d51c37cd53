package tech.policyhub.rbac.authorization.mapper;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.policyhub.rbac.authorization.RoleMetadata;
import tech.policyhub.rbac.authorization.RoleSource;
import tech.policyhub.rbac.authorization.entity.RoleMetadataEntity;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class RoleMetadataMapperTest {

    private static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant MODIFIED = Instant.parse("2024-02-01T00:00:00Z");

    @Test
    @DisplayName("toEntity should store the source by its value")
    void toEntity_shouldStoreSourceValue() {
        RoleMetadata domain = new RoleMetadata("role:default/dev", RoleSource.CSV_FILE, "user:default/alice");
        domain.id = "rmd_0HZXEQ5Y8JY5Z";
        domain.author = "user:default/alice";
        domain.createdAt = CREATED;
        domain.lastModified = MODIFIED;

        RoleMetadataEntity entity = RoleMetadataMapper.toEntity(domain);

        assertThat(entity.id).isEqualTo("rmd_0HZXEQ5Y8JY5Z");
        assertThat(entity.source).isEqualTo("csv-file");
        assertThat(entity.author).isEqualTo("user:default/alice");
        assertThat(entity.createdAt).isEqualTo(CREATED);
        assertThat(entity.lastModified).isEqualTo(MODIFIED);
    }

    @Test
    @DisplayName("toDomain should fall back to legacy for an unknown source")
    void toDomain_shouldFallBackToLegacySource() {
        RoleMetadataEntity entity = new RoleMetadataEntity();
        entity.roleEntityRef = "role:default/dev";
        entity.source = "unknown";

        assertThat(RoleMetadataMapper.toDomain(entity).source).isEqualTo(RoleSource.LEGACY);
        assertThat(RoleMetadataMapper.toDomain(null)).isNull();
    }

    @Test
    @DisplayName("updateEntity should never change id, author or creation time")
    void updateEntity_shouldKeepImmutableColumns() {
        RoleMetadataEntity entity = new RoleMetadataEntity();
        entity.id = "rmd_0HZXEQ5Y8JY5Z";
        entity.author = "user:default/alice";
        entity.createdAt = CREATED;

        RoleMetadata domain = new RoleMetadata("role:default/developers", RoleSource.REST, "user:default/bob");
        domain.id = "rmd_other";
        domain.author = "user:default/bob";
        domain.createdAt = MODIFIED;
        domain.lastModified = MODIFIED;
        domain.description = "Developers";

        RoleMetadataMapper.updateEntity(entity, domain);

        assertThat(entity.id).isEqualTo("rmd_0HZXEQ5Y8JY5Z");
        assertThat(entity.author).isEqualTo("user:default/alice");
        assertThat(entity.createdAt).isEqualTo(CREATED);
        assertThat(entity.roleEntityRef).isEqualTo("role:default/developers");
        assertThat(entity.modifiedBy).isEqualTo("user:default/bob");
        assertThat(entity.description).isEqualTo("Developers");
        assertThat(entity.lastModified).isEqualTo(MODIFIED);
    }
}
