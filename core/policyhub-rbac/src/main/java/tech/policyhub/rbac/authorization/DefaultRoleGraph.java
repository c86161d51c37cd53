package tech.policyhub.rbac.authorization;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.policyhub.rbac.config.RbacConfig;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link RoleGraph}.
 *
 * <p>Stores direct links only. Transitive roles are resolved per query by a
 * breadth-first walk bounded by {@code rbac.max-hierarchy-depth}, so there is
 * no derived state to rebuild after a link changes. Registered
 * {@link RoleMemberResolver}s add parents at every step of the walk.
 */
@ApplicationScoped
public class DefaultRoleGraph implements RoleGraph {

    private static final Logger LOG = Logger.getLogger(DefaultRoleGraph.class);

    // member -> direct parents
    private final Map<String, Set<String>> links = new ConcurrentHashMap<>();

    @Inject
    RbacConfig config;

    @Inject
    @Any
    Instance<RoleMemberResolver> resolverInstances;

    private List<RoleMemberResolver> resolvers = List.of();
    private int maxDepth;

    public DefaultRoleGraph() {
    }

    DefaultRoleGraph(int maxDepth, List<RoleMemberResolver> resolvers) {
        this.maxDepth = maxDepth;
        this.resolvers = List.copyOf(resolvers);
    }

    @PostConstruct
    void init() {
        maxDepth = config.maxHierarchyDepth();
        List<RoleMemberResolver> found = new ArrayList<>();
        resolverInstances.forEach(found::add);
        resolvers = List.copyOf(found);
        LOG.infof("Role graph initialized with max depth %d and %d member resolvers", maxDepth, resolvers.size());
    }

    @Override
    public void addLink(String member, String role) {
        // atomic per key with deleteLink, which drops emptied sets
        links.compute(member, (k, parents) -> {
            Set<String> updated = parents != null ? parents : ConcurrentHashMap.newKeySet();
            updated.add(role);
            return updated;
        });
    }

    @Override
    public void deleteLink(String member, String role) {
        links.computeIfPresent(member, (k, parents) -> {
            parents.remove(role);
            return parents.isEmpty() ? null : parents;
        });
    }

    @Override
    public boolean hasLink(String name, String role) {
        if (name.equals(role)) {
            return true;
        }
        return getRoles(name).contains(role);
    }

    @Override
    public List<String> getRoles(String name) {
        Set<String> found = new LinkedHashSet<>();
        Deque<String> frontier = new ArrayDeque<>();
        frontier.add(name);

        for (int depth = 0; depth < maxDepth && !frontier.isEmpty(); depth++) {
            Deque<String> next = new ArrayDeque<>();
            for (String current : frontier) {
                for (String parent : directParents(current)) {
                    if (!parent.equals(name) && found.add(parent)) {
                        next.add(parent);
                    }
                }
            }
            frontier = next;
        }
        return new ArrayList<>(found);
    }

    @Override
    public void clear() {
        links.clear();
    }

    private Set<String> directParents(String name) {
        Set<String> parents = new LinkedHashSet<>(links.getOrDefault(name, Set.of()));
        for (RoleMemberResolver resolver : resolvers) {
            try {
                parents.addAll(resolver.resolveParents(name));
            } catch (RuntimeException e) {
                LOG.warnf(e, "Role member resolver %s failed for %s, skipping",
                    resolver.getClass().getSimpleName(), name);
            }
        }
        return parents;
    }
}
