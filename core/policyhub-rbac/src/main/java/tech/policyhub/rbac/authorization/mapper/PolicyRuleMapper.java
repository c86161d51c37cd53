package tech.policyhub.rbac.authorization.mapper;

import tech.policyhub.rbac.authorization.entity.PolicyRuleEntity;

import java.util.ArrayList;
import java.util.List;

/**
 * Mapper between stored rows and tuples. Trailing null fields are dropped.
 */
public final class PolicyRuleMapper {

    public static final int MAX_FIELDS = 6;

    private PolicyRuleMapper() {
    }

    public static List<String> toRule(PolicyRuleEntity entity) {
        String[] values = {entity.v0, entity.v1, entity.v2, entity.v3, entity.v4, entity.v5};
        int length = values.length;
        while (length > 0 && values[length - 1] == null) {
            length--;
        }
        List<String> rule = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            rule.add(values[i]);
        }
        return rule;
    }

    public static PolicyRuleEntity toEntity(String ptype, List<String> rule) {
        if (rule.size() > MAX_FIELDS) {
            throw new IllegalArgumentException("Tuple has " + rule.size() + " fields, at most "
                + MAX_FIELDS + " are supported: " + rule);
        }
        PolicyRuleEntity entity = new PolicyRuleEntity();
        entity.ptype = ptype;
        entity.v0 = field(rule, 0);
        entity.v1 = field(rule, 1);
        entity.v2 = field(rule, 2);
        entity.v3 = field(rule, 3);
        entity.v4 = field(rule, 4);
        entity.v5 = field(rule, 5);
        return entity;
    }

    private static String field(List<String> rule, int index) {
        return index < rule.size() ? rule.get(index) : null;
    }
}
