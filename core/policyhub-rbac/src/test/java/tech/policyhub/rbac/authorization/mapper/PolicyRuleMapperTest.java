package tech.policyhub.rbac.authorization.mapper;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.policyhub.rbac.authorization.entity.PolicyRuleEntity;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PolicyRuleMapperTest {

    @Test
    @DisplayName("toEntity should fill leading columns and leave the rest null")
    void toEntity_shouldFillLeadingColumns() {
        PolicyRuleEntity entity = PolicyRuleMapper.toEntity("g", List.of("user:default/alice", "role:default/dev"));

        assertThat(entity.ptype).isEqualTo("g");
        assertThat(entity.v0).isEqualTo("user:default/alice");
        assertThat(entity.v1).isEqualTo("role:default/dev");
        assertThat(entity.v2).isNull();
        assertThat(entity.v5).isNull();
    }

    @Test
    @DisplayName("toRule should drop trailing null columns")
    void toRule_shouldDropTrailingNulls() {
        PolicyRuleEntity entity = new PolicyRuleEntity();
        entity.ptype = "p";
        entity.v0 = "role:default/dev";
        entity.v1 = "catalog-entity";
        entity.v2 = "read";
        entity.v3 = "allow";

        assertThat(PolicyRuleMapper.toRule(entity))
            .containsExactly("role:default/dev", "catalog-entity", "read", "allow");
    }

    @Test
    @DisplayName("toEntity should reject tuples wider than the table")
    void toEntity_shouldRejectTooManyFields() {
        assertThatThrownBy(() -> PolicyRuleMapper.toEntity("p", List.of("1", "2", "3", "4", "5", "6", "7")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
