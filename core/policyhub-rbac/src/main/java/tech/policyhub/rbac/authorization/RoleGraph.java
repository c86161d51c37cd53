package tech.policyhub.rbac.authorization;

import java.util.List;

/**
 * Membership and inheritance links between principals and roles.
 *
 * <p>A single instance is shared by the {@link PolicyDelegate} and every
 * {@link EvaluationContext} it builds. Evaluation only reads from it.
 */
public interface RoleGraph {

    /**
     * Record that {@code member} belongs to (or inherits from) {@code role}.
     */
    void addLink(String member, String role);

    void deleteLink(String member, String role);

    /**
     * @return true if {@code name} holds {@code role} directly or through a
     *         chain of memberships
     */
    boolean hasLink(String name, String role);

    /**
     * All roles held by {@code name}, directly or indirectly.
     */
    List<String> getRoles(String name);

    /**
     * Drop every link. Used before reloading links from stored grouping policies.
     */
    void clear();
}
