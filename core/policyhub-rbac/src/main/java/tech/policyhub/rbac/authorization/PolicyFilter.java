package tech.policyhub.rbac.authorization;

import tech.policyhub.rbac.common.errors.MalformedFilterException;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Partial tuple match used for server-side filtered loads.
 *
 * <p>Maps field positions ({@code v0}, {@code v1}, ...) to required values.
 * Positions that are not set match anything.
 */
public final class PolicyFilter {

    private final PolicyType type;
    private final Map<Integer, String> fields;

    private PolicyFilter(PolicyType type, Map<Integer, String> fields) {
        this.type = Objects.requireNonNull(type, "type");
        this.fields = Collections.unmodifiableMap(new TreeMap<>(fields));
    }

    /**
     * Filter matching every tuple of the given type.
     */
    public static PolicyFilter all(PolicyType type) {
        return new PolicyFilter(type, Map.of());
    }

    /**
     * Filter matching exactly the given tuple.
     */
    public static PolicyFilter exact(PolicyType type, List<String> rule) {
        return forFields(type, 0, rule);
    }

    /**
     * Filter mapping {@code values} to consecutive fields starting at
     * {@code fieldIndex}.
     *
     * @throws MalformedFilterException if the index is negative, no values are
     *                                  given, a value is null, or the values run
     *                                  past the last field of the type
     */
    public static PolicyFilter forFields(PolicyType type, int fieldIndex, List<String> values) {
        if (fieldIndex < 0) {
            throw new MalformedFilterException("Field index must not be negative: " + fieldIndex);
        }
        if (values == null || values.isEmpty()) {
            throw new MalformedFilterException("At least one filter value is required");
        }
        if (fieldIndex + values.size() > type.maxFields()) {
            throw new MalformedFilterException(String.format(
                "Filter on fields v%d..v%d exceeds the %d fields of '%s' tuples",
                fieldIndex, fieldIndex + values.size() - 1, type.maxFields(), type.key()));
        }
        Map<Integer, String> fields = new TreeMap<>();
        for (int i = 0; i < values.size(); i++) {
            String value = values.get(i);
            if (value == null) {
                throw new MalformedFilterException("Filter value for field v" + (fieldIndex + i) + " is null");
            }
            fields.put(fieldIndex + i, value);
        }
        return new PolicyFilter(type, fields);
    }

    public PolicyType type() {
        return type;
    }

    /**
     * Required values keyed by field position, in ascending position order.
     */
    public Map<Integer, String> fields() {
        return fields;
    }

    public boolean matches(List<String> rule) {
        for (Map.Entry<Integer, String> field : fields.entrySet()) {
            int index = field.getKey();
            if (index >= rule.size() || !field.getValue().equals(rule.get(index))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PolicyFilter other)) {
            return false;
        }
        return type == other.type && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, fields);
    }

    @Override
    public String toString() {
        return "PolicyFilter{" + type.key() + ", " + fields + "}";
    }
}
