package tech.policyhub.rbac.shared;

/**
 * Entity types that receive generated IDs, with their 3-character prefixes.
 *
 * <p>Prefixed IDs are stored WITH the prefix in the database:
 * "{prefix}_{tsid}" (e.g., "rmd_0HZXEQ5Y8JY5Z").
 *
 * <p>Usage:
 * <pre>
 * String id = TsidGenerator.generate(EntityType.ROLE_METADATA);  // "rmd_0HZXEQ5Y8JY5Z"
 * </pre>
 */
public enum EntityType {

    ROLE_METADATA("rmd"),
    ROLE_EVENT("rev", false);      // Emitted per role creation: no prefix

    private final String prefix;
    private final boolean usePrefix;

    EntityType(String prefix) {
        this(prefix, true);
    }

    EntityType(String prefix, boolean usePrefix) {
        this.prefix = prefix;
        this.usePrefix = usePrefix;
    }

    public String prefix() {
        return prefix;
    }

    public boolean usePrefix() {
        return usePrefix;
    }
}
