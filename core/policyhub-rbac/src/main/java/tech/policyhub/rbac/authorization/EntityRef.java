package tech.policyhub.rbac.authorization;

/**
 * Helpers for entity references of the form {@code kind:namespace/name}
 * (e.g. {@code user:default/alice}, {@code role:default/admin}).
 */
public final class EntityRef {

    private EntityRef() {
    }

    /**
     * Lowercased text before the first ':' or null if there is none.
     */
    public static String kindOf(String ref) {
        if (ref == null) {
            return null;
        }
        int colon = ref.indexOf(':');
        return colon > 0 ? ref.substring(0, colon).toLowerCase() : null;
    }
}
