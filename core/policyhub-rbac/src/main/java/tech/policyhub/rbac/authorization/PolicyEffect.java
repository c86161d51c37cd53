package tech.policyhub.rbac.authorization;

import java.util.List;

/**
 * Effect carried in the fourth field of a permission tuple.
 */
public enum PolicyEffect {
    ALLOW("allow"),
    DENY("deny");

    /** Position of the effect in a permission tuple. */
    public static final int FIELD_INDEX = 3;

    private final String value;

    PolicyEffect(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Effect of a permission tuple. Tuples without an effect field allow.
     */
    public static PolicyEffect of(List<String> rule) {
        if (rule.size() <= FIELD_INDEX) {
            return ALLOW;
        }
        return DENY.value.equalsIgnoreCase(rule.get(FIELD_INDEX)) ? DENY : ALLOW;
    }
}
