package tech.policyhub.rbac.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * Centralized TSID generation.
 * TSID (Time-Sorted ID) provides:
 * - Time-sortable (creation order preserved)
 * - 64-bit efficiency (vs 128-bit UUID)
 * - Monotonic (no collisions in distributed systems)
 *
 * Format for prefixed types: "{prefix}_{tsid}" (e.g., "rmd_0HZXEQ5Y8JY5Z").
 */
public class TsidGenerator {

    /**
     * Separator between prefix and TSID.
     */
    public static final String SEPARATOR = "_";

    /**
     * Generate a new ID for the given entity type.
     *
     * @param type the entity type
     * @return the ID (with or without prefix depending on entity type)
     */
    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        String tsid = TsidCreator.getTsid().toString();
        return type.usePrefix() ? type.prefix() + SEPARATOR + tsid : tsid;
    }

    private TsidGenerator() {
        // Utility class
    }
}
