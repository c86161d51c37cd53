package tech.policyhub.rbac.authorization;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.policyhub.rbac.authorization.events.RoleAdded;
import tech.policyhub.rbac.authorization.events.RoleEventListener;
import tech.policyhub.rbac.authorization.events.RoleEventType;
import tech.policyhub.rbac.common.PolicyTransaction;
import tech.policyhub.rbac.common.TransactionProvider;
import tech.policyhub.rbac.common.TransactionScope;
import tech.policyhub.rbac.common.errors.RoleMetadataNotFoundException;
import tech.policyhub.rbac.config.RbacConfig;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Single entry point for reading, changing and evaluating policy and role state.
 *
 * <p>Coordinates three collaborators:
 * <ul>
 *   <li>{@link PolicyAdapter} - policy ("p") and grouping ("g") tuples</li>
 *   <li>{@link RoleMetadataRepository} - per-role audit/lifecycle records</li>
 *   <li>{@link RoleGraph} - in-memory membership links used for inheritance</li>
 * </ul>
 *
 * <p>Reads never load the full policy set: every query is a server-side
 * filtered load into a fresh {@link PolicyModel}.
 *
 * <p>Every mutation takes an optional caller transaction. Without one, the
 * operation opens its own and commits or rolls it back; with one, it only
 * writes through it and lets errors propagate. Role graph links and
 * {@link RoleAdded} notifications are applied after the owning transaction
 * commits, so a rollback leaves them untouched.
 */
@ApplicationScoped
public class PolicyDelegate {

    private static final Logger LOG = Logger.getLogger(PolicyDelegate.class);

    private static final String P = PolicyType.P.key();
    private static final String G = PolicyType.G.key();

    @Inject
    PolicyAdapter adapter;

    @Inject
    RoleGraph roleGraph;

    @Inject
    RoleMetadataRepository roleMetadataRepository;

    @Inject
    TransactionProvider transactionProvider;

    @Inject
    RbacConfig config;

    private final Map<RoleEventType, List<RoleEventListener>> listeners = new EnumMap<>(RoleEventType.class);

    public PolicyDelegate() {
        for (RoleEventType type : RoleEventType.values()) {
            listeners.put(type, new CopyOnWriteArrayList<>());
        }
    }

    void onStart(@Observes StartupEvent event) {
        rebuildRoleGraph();
    }

    // ========================================================================
    // Role graph
    // ========================================================================

    /**
     * Replace the role graph's links with the stored grouping tuples.
     *
     * <p>Runs at startup. Mutations committed while a rebuild is in progress
     * may be lost, so call it only when no mutations are running.
     */
    public void rebuildRoleGraph() {
        List<List<String>> grouping;
        TransactionScope scope = TransactionScope.open(transactionProvider, null);
        try {
            grouping = getGroupingPolicy();
            scope.commit();
        } catch (RuntimeException | Error e) {
            scope.rollback(e);
            throw e;
        }

        roleGraph.clear();
        for (List<String> policy : grouping) {
            roleGraph.addLink(policy.get(0), policy.get(1));
        }
        LOG.infof("Role graph rebuilt from %d grouping policies", grouping.size());
    }

    // ========================================================================
    // Notifications
    // ========================================================================

    /**
     * Register a listener. Listeners run after commit; a failing listener is
     * logged and does not affect the mutation or other listeners.
     */
    public PolicyDelegate on(RoleEventType type, RoleEventListener listener) {
        listeners.get(type).add(listener);
        return this;
    }

    public boolean removeListener(RoleEventType type, RoleEventListener listener) {
        return listeners.get(type).remove(listener);
    }

    // ========================================================================
    // Reads
    // ========================================================================

    public boolean hasPolicy(String... policy) {
        return hasPolicy(Arrays.asList(policy));
    }

    /**
     * Point check: loads only the tuples equal to {@code policy}.
     */
    public boolean hasPolicy(List<String> policy) {
        return hasTuple(PolicyType.P, policy);
    }

    public boolean hasGroupingPolicy(String... policy) {
        return hasGroupingPolicy(Arrays.asList(policy));
    }

    public boolean hasGroupingPolicy(List<String> policy) {
        return hasTuple(PolicyType.G, policy);
    }

    public List<List<String>> getPolicy() {
        return load(PolicyType.P, List.of(PolicyFilter.all(PolicyType.P)));
    }

    public List<List<String>> getGroupingPolicy() {
        return load(PolicyType.G, List.of(PolicyFilter.all(PolicyType.G)));
    }

    /**
     * Policy tuples whose fields starting at {@code fieldIndex} equal
     * {@code values}, in order.
     *
     * @throws tech.policyhub.rbac.common.errors.MalformedFilterException before any I/O
     *         if the fields fall outside the tuple
     */
    public List<List<String>> getFilteredPolicy(int fieldIndex, String... values) {
        PolicyFilter filter = PolicyFilter.forFields(PolicyType.P, fieldIndex, Arrays.asList(values));
        return load(PolicyType.P, List.of(filter));
    }

    public List<List<String>> getFilteredGroupingPolicy(int fieldIndex, String... values) {
        PolicyFilter filter = PolicyFilter.forFields(PolicyType.G, fieldIndex, Arrays.asList(values));
        return load(PolicyType.G, List.of(filter));
    }

    public List<String> getRolesForUser(String userEntityRef) {
        return roleGraph.getRoles(userEntityRef);
    }

    /**
     * Permission tuples granted to {@code user} through every role it holds.
     * The same tuple appears once per role granting it.
     */
    public List<List<String>> getImplicitPermissionsForUser(String user) {
        List<List<String>> permissions = new ArrayList<>();
        for (String role : getRolesForUser(user)) {
            permissions.addAll(getFilteredPolicy(0, role));
        }
        return permissions;
    }

    // ========================================================================
    // Policy mutations
    // ========================================================================

    public void addPolicy(List<String> policy) {
        addPolicy(policy, null);
    }

    /**
     * Store a policy tuple. Adding a tuple that already exists is a no-op.
     */
    public void addPolicy(List<String> policy, PolicyTransaction externalTx) {
        requirePolicyTuple(policy);
        if (hasPolicy(policy)) {
            LOG.debugf("Policy %s already exists, skipping", policy);
            return;
        }
        TransactionScope scope = TransactionScope.open(transactionProvider, externalTx);
        try {
            adapter.addPolicy(P, P, policy);
            scope.commit();
        } catch (RuntimeException | Error e) {
            scope.rollback(e);
            throw e;
        }
    }

    public void addPolicies(List<List<String>> policies) {
        addPolicies(policies, null);
    }

    /**
     * Store policy tuples. Duplicates are left to the adapter, which ignores them.
     */
    public void addPolicies(List<List<String>> policies, PolicyTransaction externalTx) {
        if (policies.isEmpty()) {
            return;
        }
        policies.forEach(PolicyDelegate::requirePolicyTuple);
        TransactionScope scope = TransactionScope.open(transactionProvider, externalTx);
        try {
            for (List<String> policy : policies) {
                adapter.addPolicy(P, P, policy);
            }
            scope.commit();
            LOG.debugf("Added %d policies", policies.size());
        } catch (RuntimeException | Error e) {
            scope.rollback(e);
            throw e;
        }
    }

    public void removePolicy(List<String> policy) {
        removePolicy(policy, null);
    }

    public void removePolicy(List<String> policy, PolicyTransaction externalTx) {
        requirePolicyTuple(policy);
        TransactionScope scope = TransactionScope.open(transactionProvider, externalTx);
        try {
            adapter.removePolicy(P, P, policy);
            scope.commit();
        } catch (RuntimeException | Error e) {
            scope.rollback(e);
            throw e;
        }
    }

    public void removePolicies(List<List<String>> policies) {
        removePolicies(policies, null);
    }

    public void removePolicies(List<List<String>> policies, PolicyTransaction externalTx) {
        policies.forEach(PolicyDelegate::requirePolicyTuple);
        TransactionScope scope = TransactionScope.open(transactionProvider, externalTx);
        try {
            for (List<String> policy : policies) {
                adapter.removePolicy(P, P, policy);
            }
            scope.commit();
        } catch (RuntimeException | Error e) {
            scope.rollback(e);
            throw e;
        }
    }

    public void updatePolicies(List<List<String>> oldPolicies, List<List<String>> newPolicies) {
        updatePolicies(oldPolicies, newPolicies, null);
    }

    /**
     * Replace {@code oldPolicies} with {@code newPolicies} atomically.
     */
    public void updatePolicies(List<List<String>> oldPolicies, List<List<String>> newPolicies,
                               PolicyTransaction externalTx) {
        oldPolicies.forEach(PolicyDelegate::requirePolicyTuple);
        newPolicies.forEach(PolicyDelegate::requirePolicyTuple);
        TransactionScope scope = TransactionScope.open(transactionProvider, externalTx);
        try {
            removePolicies(oldPolicies, scope.transaction());
            addPolicies(newPolicies, scope.transaction());
            scope.commit();
        } catch (RuntimeException | Error e) {
            scope.rollback(e);
            throw e;
        }
    }

    // ========================================================================
    // Grouping mutations
    // ========================================================================

    public void addGroupingPolicy(List<String> policy, RoleMetadata roleMetadata) {
        addGroupingPolicy(policy, roleMetadata, null);
    }

    /**
     * Add a member to a role.
     *
     * <p>Creates the role's metadata record (and emits {@link RoleAdded} after
     * commit) if the role is new, otherwise merges {@code roleMetadata} into it.
     * Adding a tuple that already exists is a no-op.
     */
    public void addGroupingPolicy(List<String> policy, RoleMetadata roleMetadata, PolicyTransaction externalTx) {
        requireGroupingTuple(policy);
        if (hasGroupingPolicy(policy)) {
            LOG.debugf("Grouping policy %s already exists, skipping", policy);
            return;
        }
        TransactionScope scope = TransactionScope.open(transactionProvider, externalTx);
        try {
            PolicyTransaction tx = scope.transaction();
            boolean created = saveRoleMetadata(roleMetadata, tx);

            adapter.addPolicy(G, G, policy);
            linkAfterCommit(tx, policy);

            if (created) {
                publishAfterCommit(tx, roleMetadata.roleEntityRef);
            }
            scope.commit();
        } catch (RuntimeException | Error e) {
            scope.rollback(e);
            throw e;
        }
    }

    public void addGroupingPolicies(List<List<String>> policies, RoleMetadata roleMetadata) {
        addGroupingPolicies(policies, roleMetadata, null);
    }

    /**
     * Add members to one role. Every tuple must target
     * {@code roleMetadata.roleEntityRef}. The metadata is created or merged
     * once for the whole batch, and at most one {@link RoleAdded} is emitted.
     */
    public void addGroupingPolicies(List<List<String>> policies, RoleMetadata roleMetadata,
                                    PolicyTransaction externalTx) {
        if (policies.isEmpty()) {
            return;
        }
        requireSameRole(policies, roleMetadata.roleEntityRef);

        TransactionScope scope = TransactionScope.open(transactionProvider, externalTx);
        try {
            PolicyTransaction tx = scope.transaction();
            boolean created = saveRoleMetadata(roleMetadata, tx);

            for (List<String> policy : policies) {
                adapter.addPolicy(G, G, policy);
                linkAfterCommit(tx, policy);
            }

            if (created) {
                publishAfterCommit(tx, roleMetadata.roleEntityRef);
            }
            scope.commit();
            LOG.debugf("Added %d members to %s", policies.size(), roleMetadata.roleEntityRef);
        } catch (RuntimeException | Error e) {
            scope.rollback(e);
            throw e;
        }
    }

    public void removeGroupingPolicy(List<String> policy, RoleMetadata roleMetadata) {
        removeGroupingPolicy(policy, roleMetadata, false, null);
    }

    /**
     * Remove a member from a role.
     *
     * <p>Unless {@code isUpdate}, the role's metadata is deleted when no members
     * remain (except for the administrative role) and merged otherwise.
     */
    public void removeGroupingPolicy(List<String> policy, RoleMetadata roleMetadata, boolean isUpdate,
                                     PolicyTransaction externalTx) {
        requireGroupingTuple(policy);
        removeGroupingTuples(List.of(policy), policy.get(1), roleMetadata, isUpdate, externalTx);
    }

    public void removeGroupingPolicies(List<List<String>> policies, RoleMetadata roleMetadata) {
        removeGroupingPolicies(policies, roleMetadata, false, null);
    }

    /**
     * Remove members from the role named by {@code roleMetadata.roleEntityRef}.
     *
     * @see #removeGroupingPolicy(List, RoleMetadata, boolean, PolicyTransaction)
     */
    public void removeGroupingPolicies(List<List<String>> policies, RoleMetadata roleMetadata, boolean isUpdate,
                                       PolicyTransaction externalTx) {
        requireSameRole(policies, roleMetadata.roleEntityRef);
        removeGroupingTuples(policies, roleMetadata.roleEntityRef, roleMetadata, isUpdate, externalTx);
    }

    public void updateGroupingPolicies(List<List<String>> oldRole, List<List<String>> newRole,
                                       RoleMetadata newRoleMetadata) {
        updateGroupingPolicies(oldRole, newRole, newRoleMetadata, null);
    }

    /**
     * Replace the members of a role atomically.
     *
     * <p>{@code oldRole} must be non-empty and target a single role, which must
     * have a metadata record. {@code newRole} must be non-empty and target
     * {@code newRoleMetadata.roleEntityRef}. When the role reference changes and
     * the old role is left without members, its record is carried over to the
     * new reference (keeping its creation data) instead of creating a new one.
     *
     * @throws IllegalArgumentException     if a precondition on the tuple sets fails (before any I/O)
     * @throws RoleMetadataNotFoundException if the old role has no metadata record
     */
    public void updateGroupingPolicies(List<List<String>> oldRole, List<List<String>> newRole,
                                       RoleMetadata newRoleMetadata, PolicyTransaction externalTx) {
        String oldRoleName = requireSingleRole(oldRole, "old");
        if (newRole.isEmpty()) {
            throw new IllegalArgumentException("Cannot update role " + oldRoleName + " to an empty member set");
        }
        requireSameRole(newRole, newRoleMetadata.roleEntityRef);

        TransactionScope scope = TransactionScope.open(transactionProvider, externalTx);
        try {
            PolicyTransaction tx = scope.transaction();
            RoleMetadata currentMetadata = roleMetadataRepository.findRoleMetadata(oldRoleName, tx)
                .orElseThrow(() -> new RoleMetadataNotFoundException(oldRoleName));

            removeGroupingPolicies(oldRole, currentMetadata, true, tx);
            if (!oldRoleName.equals(newRoleMetadata.roleEntityRef)) {
                carryOverRenamedRole(oldRoleName, currentMetadata, newRoleMetadata, tx);
            }
            addGroupingPolicies(newRole, newRoleMetadata, tx);
            scope.commit();
        } catch (RuntimeException | Error e) {
            scope.rollback(e);
            throw e;
        }
    }

    // ========================================================================
    // Evaluation
    // ========================================================================

    /**
     * Decide whether {@code entityRef} may perform {@code action} on
     * {@code resourceType}.
     *
     * <p>Only the tuples relevant to this request are loaded: one filter per
     * role in {@code roles}, or, when no roles are given, the tuples for the
     * resource and action assigned directly to users and groups. The decision
     * runs in a throwaway {@link EvaluationContext} that shares this
     * delegate's role graph.
     *
     * @param roles roles the subject holds directly or indirectly (may be empty)
     */
    public boolean enforce(String entityRef, String resourceType, String action, List<String> roles) {
        List<PolicyFilter> filters = new ArrayList<>();
        if (!roles.isEmpty()) {
            for (String role : roles) {
                filters.add(PolicyFilter.forFields(PolicyType.P, 0, List.of(role, resourceType, action)));
            }
        } else {
            filters.add(PolicyFilter.forFields(PolicyType.P, 1, List.of(resourceType, action)));
        }

        PolicyModel model = new PolicyModel();
        adapter.loadFilteredPolicy(model, filters);
        if (roles.isEmpty()) {
            model = principalAssignedOnly(model);
        }

        EvaluationContext context = EvaluationContext.of(model, roleGraph);
        context.enableAutoBuildRoleLinks(false);
        context.buildRoleLinks();

        boolean allowed = context.enforce(entityRef, resourceType, action);
        LOG.debugf("enforce(%s, %s, %s) over %d policies -> %s",
            entityRef, resourceType, action, model.size(PolicyType.P), allowed ? "allow" : "deny");
        return allowed;
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private boolean hasTuple(PolicyType type, List<String> policy) {
        PolicyModel model = new PolicyModel();
        adapter.loadFilteredPolicy(model, List.of(PolicyFilter.exact(type, policy)));
        return model.hasPolicy(type, policy);
    }

    private List<List<String>> load(PolicyType type, List<PolicyFilter> filters) {
        PolicyModel model = new PolicyModel();
        adapter.loadFilteredPolicy(model, filters);
        return model.getPolicy(type);
    }

    /**
     * Keep only tuples whose subject is a user or group, so permissions
     * granted to roles cannot apply to a check made without resolved roles.
     */
    private PolicyModel principalAssignedOnly(PolicyModel loaded) {
        PolicyModel filtered = new PolicyModel();
        List<String> principalKinds = config.principalKinds();
        for (List<String> policy : loaded.getPolicy(PolicyType.P)) {
            String kind = EntityRef.kindOf(policy.get(0));
            if (kind != null && principalKinds.contains(kind)) {
                filtered.addPolicy(PolicyType.P, policy);
            }
        }
        return filtered;
    }

    /**
     * Create or merge the role's metadata.
     *
     * @return true if a new record was created
     */
    private boolean saveRoleMetadata(RoleMetadata incoming, PolicyTransaction tx) {
        String roleEntityRef = incoming.roleEntityRef;
        Optional<RoleMetadata> current = roleMetadataRepository.findRoleMetadata(roleEntityRef, tx);
        if (current.isPresent()) {
            roleMetadataRepository.updateRoleMetadata(
                RoleMetadataMerger.merge(current.get(), incoming), roleEntityRef, tx);
            return false;
        }

        RoleMetadata created = incoming.copy();
        Instant now = Instant.now();
        created.createdAt = now;
        created.lastModified = now;
        if (created.author == null) {
            created.author = created.modifiedBy;
        }
        roleMetadataRepository.createRoleMetadata(created, tx);
        return true;
    }

    private void removeGroupingTuples(List<List<String>> policies, String roleEntityRef, RoleMetadata roleMetadata,
                                      boolean isUpdate, PolicyTransaction externalTx) {
        TransactionScope scope = TransactionScope.open(transactionProvider, externalTx);
        try {
            PolicyTransaction tx = scope.transaction();
            for (List<String> policy : policies) {
                adapter.removePolicy(G, G, policy);
                unlinkAfterCommit(tx, policy);
            }

            if (!isUpdate) {
                reconcileRoleMetadata(roleEntityRef, roleMetadata, tx);
            }
            scope.commit();
        } catch (RuntimeException | Error e) {
            scope.rollback(e);
            throw e;
        }
    }

    /**
     * Delete the role's metadata if it has no members left, otherwise merge.
     */
    private void reconcileRoleMetadata(String roleEntityRef, RoleMetadata incoming, PolicyTransaction tx) {
        Optional<RoleMetadata> current = roleMetadataRepository.findRoleMetadata(roleEntityRef, tx);
        if (current.isEmpty()) {
            return;
        }
        boolean noMembersLeft = getFilteredGroupingPolicy(1, roleEntityRef).isEmpty();
        if (noMembersLeft && !config.isAdminRole(roleEntityRef)) {
            roleMetadataRepository.removeRoleMetadata(roleEntityRef, tx);
            LOG.debugf("Removed metadata of role %s, no members left", roleEntityRef);
            return;
        }
        if (noMembersLeft) {
            LOG.infof("Keeping metadata of administrative role %s with no members", roleEntityRef);
        }
        roleMetadataRepository.updateRoleMetadata(
            RoleMetadataMerger.merge(current.get(), incoming), roleEntityRef, tx);
    }

    private void carryOverRenamedRole(String oldRoleName, RoleMetadata oldMetadata, RoleMetadata newMetadata,
                                      PolicyTransaction tx) {
        boolean oldRoleEmpty = getFilteredGroupingPolicy(1, oldRoleName).isEmpty();
        if (!oldRoleEmpty || config.isAdminRole(oldRoleName)) {
            return;
        }
        String newRoleName = newMetadata.roleEntityRef;
        if (roleMetadataRepository.findRoleMetadata(newRoleName, tx).isEmpty()) {
            roleMetadataRepository.updateRoleMetadata(
                RoleMetadataMerger.merge(oldMetadata, newMetadata), oldRoleName, tx);
            LOG.debugf("Renamed role metadata %s to %s", oldRoleName, newRoleName);
        } else {
            roleMetadataRepository.removeRoleMetadata(oldRoleName, tx);
            LOG.debugf("Removed metadata of role %s, members moved to %s", oldRoleName, newRoleName);
        }
    }

    private void linkAfterCommit(PolicyTransaction tx, List<String> policy) {
        String member = policy.get(0);
        String role = policy.get(1);
        tx.afterCommit(() -> roleGraph.addLink(member, role));
    }

    private void unlinkAfterCommit(PolicyTransaction tx, List<String> policy) {
        String member = policy.get(0);
        String role = policy.get(1);
        tx.afterCommit(() -> roleGraph.deleteLink(member, role));
    }

    private void publishAfterCommit(PolicyTransaction tx, String roleEntityRef) {
        tx.afterCommit(() -> publish(RoleAdded.forRoles(List.of(roleEntityRef)).build()));
    }

    private void publish(RoleAdded event) {
        for (RoleEventListener listener : listeners.get(RoleEventType.ROLE_ADDED)) {
            try {
                listener.onRoleAdded(event);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Role event listener failed for %s", event.roleEntityRefs());
            }
        }
    }

    private static void requirePolicyTuple(List<String> policy) {
        if (policy.isEmpty() || policy.size() > PolicyType.P.maxFields()) {
            throw new IllegalArgumentException("Policy must have 1 to " + PolicyType.P.maxFields()
                + " fields, got " + policy);
        }
        requireNoNullFields(policy);
    }

    private static void requireGroupingTuple(List<String> policy) {
        if (policy.size() != 2) {
            throw new IllegalArgumentException("Grouping policy must be [member, role], got " + policy);
        }
        requireNoNullFields(policy);
    }

    private static void requireNoNullFields(List<String> policy) {
        for (String field : policy) {
            if (field == null) {
                throw new IllegalArgumentException("Policy " + policy + " has a null field");
            }
        }
    }

    private static void requireSameRole(List<List<String>> policies, String roleEntityRef) {
        for (List<String> policy : policies) {
            requireGroupingTuple(policy);
            if (!policy.get(1).equals(roleEntityRef)) {
                throw new IllegalArgumentException(String.format(
                    "Grouping policy %s does not target role %s", policy, roleEntityRef));
            }
        }
    }

    private static String requireSingleRole(List<List<String>> policies, String label) {
        if (policies.isEmpty()) {
            throw new IllegalArgumentException("The " + label + " member set is empty, cannot determine the role");
        }
        requireGroupingTuple(policies.get(0));
        String role = policies.get(0).get(1);
        requireSameRole(policies, role);
        return role;
    }
}
