package tech.policyhub.rbac.authorization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PolicyModelTest {

    @Test
    @DisplayName("addPolicies should de-duplicate and keep insertion order")
    void addPolicies_shouldDeduplicateInInsertionOrder() {
        PolicyModel model = new PolicyModel();

        model.addPolicies(PolicyType.P, List.of(
            List.of("role:default/b", "catalog-entity", "read"),
            List.of("role:default/a", "catalog-entity", "read"),
            List.of("role:default/b", "catalog-entity", "read")));

        assertThat(model.getPolicy(PolicyType.P)).containsExactly(
            List.of("role:default/b", "catalog-entity", "read"),
            List.of("role:default/a", "catalog-entity", "read"));
        assertThat(model.size(PolicyType.G)).isZero();
    }

    @Test
    @DisplayName("stored tuples should not change when the caller's list changes")
    void addPolicy_shouldStoreCopy() {
        PolicyModel model = new PolicyModel();
        List<String> rule = new ArrayList<>(List.of("user:default/a", "role:default/b"));

        assertThat(model.addPolicy(PolicyType.G, rule)).isTrue();
        rule.set(1, "role:default/c");

        assertThat(model.hasPolicy(PolicyType.G, List.of("user:default/a", "role:default/b"))).isTrue();
        assertThat(model.addPolicy(PolicyType.G, List.of("user:default/a", "role:default/b"))).isFalse();
    }

    @Test
    @DisplayName("removePolicy and clearPolicy should drop tuples")
    void removeAndClear_shouldDropTuples() {
        PolicyModel model = new PolicyModel();
        model.addPolicy(PolicyType.P, List.of("a", "b", "c"));
        model.addPolicy(PolicyType.G, List.of("a", "b"));

        assertThat(model.removePolicy(PolicyType.P, List.of("a", "b", "c"))).isTrue();
        assertThat(model.removePolicy(PolicyType.P, List.of("a", "b", "c"))).isFalse();

        model.clearPolicy();
        assertThat(model.size(PolicyType.G)).isZero();
    }
}
