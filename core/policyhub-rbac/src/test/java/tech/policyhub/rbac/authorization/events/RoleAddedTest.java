package tech.policyhub.rbac.authorization.events;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RoleAddedTest {

    @Test
    @DisplayName("forRoles should assign an unprefixed event id and the current time")
    void forRoles_shouldAssignIdAndTime() {
        Instant before = Instant.now();

        RoleAdded event = RoleAdded.forRoles(List.of("role:default/dev")).build();

        assertThat(event.eventId()).hasSize(13).doesNotContain("_");
        assertThat(event.time()).isBetween(before, Instant.now());
        assertThat(event.roleEntityRef()).isEqualTo("role:default/dev");
        assertThat(event.eventType()).isEqualTo("rbac:role:added");
    }

    @Test
    @DisplayName("roleEntityRefs should be an immutable copy")
    void roleEntityRefs_shouldBeImmutableCopy() {
        List<String> refs = new ArrayList<>(List.of("role:default/dev"));
        RoleAdded event = RoleAdded.builder().roleEntityRefs(refs).build();
        refs.add("role:default/ops");

        assertThat(event.roleEntityRefs()).containsExactly("role:default/dev");
        assertThatThrownBy(() -> event.roleEntityRefs().add("x"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThat(RoleAdded.builder().build().roleEntityRef()).isNull();
    }

    @Test
    @DisplayName("toDataJson should serialize references and ISO time")
    void toDataJson_shouldSerializeData() {
        RoleAdded event = RoleAdded.builder()
            .eventId("rev_1")
            .time(Instant.parse("2024-01-01T00:00:00Z"))
            .roleEntityRefs(List.of("role:default/dev"))
            .build();

        assertThat(event.toDataJson())
            .contains("\"roleEntityRefs\":[\"role:default/dev\"]")
            .contains("\"time\":\"2024-01-01T00:00:00Z\"")
            .doesNotContain("rev_1");
    }
}
