package tech.policyhub.rbac.authorization.panache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.policyhub.rbac.authorization.PolicyFilter;
import tech.policyhub.rbac.authorization.PolicyType;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class PolicyRuleQueryTest {

    @Test
    @DisplayName("forFilters should OR one clause per filter")
    void forFilters_shouldOrClausesPerFilter() {
        PolicyRuleQuery query = PolicyRuleQuery.forFilters(List.of(
            PolicyFilter.forFields(PolicyType.P, 0, List.of("role:default/dev", "catalog-entity", "read")),
            PolicyFilter.forFields(PolicyType.P, 1, List.of("catalog-entity", "read"))));

        assertThat(query.where()).isEqualTo(
            "(ptype = :t0 AND v0 = :f0_0 AND v1 = :f0_1 AND v2 = :f0_2)"
                + " OR (ptype = :t1 AND v1 = :f1_1 AND v2 = :f1_2)");
        assertThat(query.parameters())
            .containsEntry("t0", "p")
            .containsEntry("f0_0", "role:default/dev")
            .containsEntry("f1_2", "read")
            .hasSize(7);
    }

    @Test
    @DisplayName("forFilters should select a whole type for an unrestricted filter")
    void forFilters_shouldSelectType_whenFilterHasNoFields() {
        PolicyRuleQuery query = PolicyRuleQuery.forFilters(List.of(PolicyFilter.all(PolicyType.G)));

        assertThat(query.where()).isEqualTo("(ptype = :t0)");
        assertThat(query.parameters()).containsExactly(Map.entry("t0", "g"));
    }

    @Test
    @DisplayName("forFilters should require at least one filter")
    void forFilters_shouldThrow_whenNoFilters() {
        assertThatThrownBy(() -> PolicyRuleQuery.forFilters(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("forRule should match unset trailing columns as null")
    void forRule_shouldMatchTrailingColumnsAsNull() {
        PolicyRuleQuery query = PolicyRuleQuery.forRule("g", List.of("user:default/alice", "role:default/dev"));

        assertThat(query.where()).isEqualTo(
            "ptype = :ptype AND v0 = :v0 AND v1 = :v1"
                + " AND v2 IS NULL AND v3 IS NULL AND v4 IS NULL AND v5 IS NULL");
        assertThat(query.parameters()).containsOnlyKeys("ptype", "v0", "v1");
    }
}
