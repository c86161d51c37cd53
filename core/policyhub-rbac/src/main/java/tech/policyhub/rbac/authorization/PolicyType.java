package tech.policyhub.rbac.authorization;

/**
 * The two kinds of stored tuples.
 *
 * <p>The key doubles as section name and tuple type in {@link PolicyAdapter}
 * calls ({@code addPolicy("p", "p", rule)}).
 */
public enum PolicyType {

    /** Permission rule: {@code [subject, resourceType, action, effect]}. */
    P("p", 6),

    /** Membership/inheritance rule: {@code [member, role]}. */
    G("g", 2);

    private final String key;
    private final int maxFields;

    PolicyType(String key, int maxFields) {
        this.key = key;
        this.maxFields = maxFields;
    }

    public String key() {
        return key;
    }

    /**
     * Number of addressable fields ({@code v0} up to {@code v<maxFields-1>}).
     */
    public int maxFields() {
        return maxFields;
    }

    public static PolicyType fromKey(String key) {
        for (PolicyType type : values()) {
            if (type.key.equals(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown policy type: " + key);
    }
}
