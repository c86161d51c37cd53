package tech.policyhub.rbac.authorization;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Throwaway rule evaluator for a single authorization decision.
 *
 * <p>Holds a minimal {@link PolicyModel} (only the tuples relevant to one
 * request) and a reference to the shared {@link RoleGraph}. It has no
 * adapter: evaluation runs purely in memory.
 *
 * <p>Matcher: {@code g(r.sub, p.sub) && r.obj == p.obj && r.act == p.act}.
 * Effect: allowed when at least one matching tuple allows and none denies.
 *
 * <p>The shared graph is only read. Grouping tuples present in the model are
 * linked in a context-local overlay by {@link #buildRoleLinks()}.
 */
public final class EvaluationContext {

    private final PolicyModel model;
    private final RoleGraph roleGraph;

    // member -> direct parents, from the model's own grouping tuples
    private final Map<String, Set<String>> localLinks = new HashMap<>();

    private boolean autoBuildRoleLinks = true;
    private boolean linksBuilt;

    private EvaluationContext(PolicyModel model, RoleGraph roleGraph) {
        this.model = Objects.requireNonNull(model, "model");
        this.roleGraph = Objects.requireNonNull(roleGraph, "roleGraph");
    }

    /**
     * Build a context over {@code model}. The graph is shared, not copied.
     */
    public static EvaluationContext of(PolicyModel model, RoleGraph roleGraph) {
        return new EvaluationContext(model, roleGraph);
    }

    /**
     * When enabled, the first {@link #enforce} builds the local overlay if
     * {@link #buildRoleLinks()} has not been called yet. When disabled, the
     * overlay stays empty until it is built explicitly.
     */
    public void enableAutoBuildRoleLinks(boolean enabled) {
        this.autoBuildRoleLinks = enabled;
    }

    /**
     * Rebuild the local link overlay from the model's grouping tuples.
     */
    public void buildRoleLinks() {
        localLinks.clear();
        for (List<String> rule : model.getPolicy(PolicyType.G)) {
            if (rule.size() >= 2) {
                localLinks.computeIfAbsent(rule.get(0), k -> new HashSet<>()).add(rule.get(1));
            }
        }
        linksBuilt = true;
    }

    public boolean enforce(String subject, String resourceType, String action) {
        if (autoBuildRoleLinks && !linksBuilt) {
            buildRoleLinks();
        }
        boolean allowed = false;
        for (List<String> rule : model.getPolicy(PolicyType.P)) {
            if (rule.size() < 3) {
                continue;
            }
            if (!resourceType.equals(rule.get(1)) || !action.equals(rule.get(2))) {
                continue;
            }
            if (!inheritsFrom(subject, rule.get(0))) {
                continue;
            }
            if (PolicyEffect.of(rule) == PolicyEffect.DENY) {
                return false;
            }
            allowed = true;
        }
        return allowed;
    }

    /**
     * {@code g(subject, policySubject)}.
     */
    boolean inheritsFrom(String subject, String policySubject) {
        if (subject.equals(policySubject)) {
            return true;
        }
        if (roleGraph.hasLink(subject, policySubject)) {
            return true;
        }
        return hasLocalLink(subject, policySubject);
    }

    private boolean hasLocalLink(String subject, String role) {
        if (localLinks.isEmpty()) {
            return false;
        }
        Set<String> seen = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.add(subject);
        while (!pending.isEmpty()) {
            String current = pending.poll();
            for (String parent : localLinks.getOrDefault(current, Set.of())) {
                if (parent.equals(role)) {
                    return true;
                }
                if (seen.add(parent)) {
                    pending.add(parent);
                }
            }
        }
        return false;
    }
}
