package tech.policyhub.rbac.authorization;

import java.util.Set;

/**
 * Contributes membership links that are not stored as grouping tuples,
 * e.g. group membership derived from an external catalog.
 *
 * <p>Beans implementing this interface are picked up by {@link DefaultRoleGraph}.
 */
public interface RoleMemberResolver {

    /**
     * Direct parents of {@code name} known to this resolver.
     */
    Set<String> resolveParents(String name);
}
