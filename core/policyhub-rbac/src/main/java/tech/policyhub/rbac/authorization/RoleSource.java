package tech.policyhub.rbac.authorization;

/**
 * Source of a role definition.
 */
public enum RoleSource {
    /** Created through the REST API */
    REST("rest"),
    /** Loaded from a policy CSV file */
    CSV_FILE("csv-file"),
    /** Declared in application configuration */
    CONFIGURATION("configuration"),
    /** Created before sources were tracked */
    LEGACY("legacy");

    private final String value;

    RoleSource(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static RoleSource fromValue(String value) {
        for (RoleSource source : values()) {
            if (source.value.equals(value)) {
                return source;
            }
        }
        return LEGACY;
    }
}
