package tech.policyhub.rbac.authorization.panache;

import tech.policyhub.rbac.authorization.PolicyFilter;
import tech.policyhub.rbac.authorization.mapper.PolicyRuleMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JPQL condition and named parameters selecting policy rule rows.
 *
 * <p>{@link #forFilters(List)} ORs one clause per filter, each clause ANDing
 * the type and the filter's fields. {@link #forRule(String, List)} matches a
 * single stored tuple exactly, including its unset trailing fields.
 */
public final class PolicyRuleQuery {

    private final String where;
    private final Map<String, Object> parameters;

    private PolicyRuleQuery(String where, Map<String, Object> parameters) {
        this.where = where;
        this.parameters = Collections.unmodifiableMap(parameters);
    }

    public static PolicyRuleQuery forFilters(List<PolicyFilter> filters) {
        if (filters.isEmpty()) {
            throw new IllegalArgumentException("At least one filter is required");
        }
        StringBuilder where = new StringBuilder();
        Map<String, Object> parameters = new LinkedHashMap<>();
        for (int i = 0; i < filters.size(); i++) {
            PolicyFilter filter = filters.get(i);
            if (i > 0) {
                where.append(" OR ");
            }
            String typeParam = "t" + i;
            where.append("(ptype = :").append(typeParam);
            parameters.put(typeParam, filter.type().key());
            for (Map.Entry<Integer, String> field : filter.fields().entrySet()) {
                String param = "f" + i + "_" + field.getKey();
                where.append(" AND v").append(field.getKey()).append(" = :").append(param);
                parameters.put(param, field.getValue());
            }
            where.append(")");
        }
        return new PolicyRuleQuery(where.toString(), parameters);
    }

    public static PolicyRuleQuery forRule(String ptype, List<String> rule) {
        if (rule.size() > PolicyRuleMapper.MAX_FIELDS) {
            throw new IllegalArgumentException("Tuple has more than " + PolicyRuleMapper.MAX_FIELDS
                + " fields: " + rule);
        }
        StringBuilder where = new StringBuilder("ptype = :ptype");
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("ptype", ptype);
        for (int i = 0; i < PolicyRuleMapper.MAX_FIELDS; i++) {
            if (i < rule.size()) {
                where.append(" AND v").append(i).append(" = :v").append(i);
                parameters.put("v" + i, rule.get(i));
            } else {
                where.append(" AND v").append(i).append(" IS NULL");
            }
        }
        return new PolicyRuleQuery(where.toString(), parameters);
    }

    public String where() {
        return where;
    }

    public Map<String, Object> parameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return where + " " + parameters;
    }
}
