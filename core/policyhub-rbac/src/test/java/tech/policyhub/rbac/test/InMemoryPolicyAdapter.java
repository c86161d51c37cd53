package tech.policyhub.rbac.test;

import tech.policyhub.rbac.authorization.PolicyAdapter;
import tech.policyhub.rbac.authorization.PolicyFilter;
import tech.policyhub.rbac.authorization.PolicyModel;
import tech.policyhub.rbac.authorization.PolicyType;
import tech.policyhub.rbac.common.errors.PolicyStoreException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link PolicyAdapter} backed by in-memory sets. Writes require an open
 * {@link InMemoryTransaction} and are undone on rollback.
 */
public class InMemoryPolicyAdapter implements PolicyAdapter {

    private final InMemoryTransactionProvider transactions;
    private final Map<PolicyType, Set<List<String>>> rules = new EnumMap<>(PolicyType.class);
    private final Set<List<String>> failingRules = new HashSet<>();
    private final Map<List<String>, Error> erroringRules = new HashMap<>();
    private final List<List<PolicyFilter>> loads = new ArrayList<>();

    public InMemoryPolicyAdapter(InMemoryTransactionProvider transactions) {
        this.transactions = transactions;
        for (PolicyType type : PolicyType.values()) {
            rules.put(type, new LinkedHashSet<>());
        }
    }

    @Override
    public void loadFilteredPolicy(PolicyModel model, List<PolicyFilter> filters) {
        loads.add(List.copyOf(filters));
        for (PolicyFilter filter : filters) {
            for (List<String> rule : rules.get(filter.type())) {
                if (filter.matches(rule)) {
                    model.addPolicy(filter.type(), rule);
                }
            }
        }
    }

    @Override
    public void addPolicy(String section, String ptype, List<String> rule) {
        InMemoryTransaction tx = requireTransaction();
        if (failingRules.contains(rule)) {
            throw new PolicyStoreException("Simulated write failure for " + rule);
        }
        Error error = erroringRules.get(rule);
        if (error != null) {
            throw error;
        }
        Set<List<String>> stored = rules.get(PolicyType.fromKey(ptype));
        List<String> copy = List.copyOf(rule);
        if (stored.add(copy)) {
            tx.recordUndo(() -> stored.remove(copy));
        }
    }

    @Override
    public void removePolicy(String section, String ptype, List<String> rule) {
        InMemoryTransaction tx = requireTransaction();
        Set<List<String>> stored = rules.get(PolicyType.fromKey(ptype));
        List<String> copy = List.copyOf(rule);
        if (stored.remove(copy)) {
            tx.recordUndo(() -> stored.add(copy));
        }
    }

    /**
     * Store a tuple outside any transaction.
     */
    public void seed(PolicyType type, String... rule) {
        rules.get(type).add(List.of(rule));
    }

    public void failOnWrite(List<String> rule) {
        failingRules.add(rule);
    }

    /**
     * Writing {@code rule} throws {@code error} instead of a store exception.
     */
    public void failOnWrite(List<String> rule, Error error) {
        erroringRules.put(rule, error);
    }

    public boolean contains(PolicyType type, String... rule) {
        return rules.get(type).contains(List.of(rule));
    }

    public List<List<String>> rules(PolicyType type) {
        return new ArrayList<>(rules.get(type));
    }

    /**
     * Filters passed to each load, in call order.
     */
    public List<List<PolicyFilter>> loads() {
        return loads;
    }

    private InMemoryTransaction requireTransaction() {
        InMemoryTransaction tx = transactions.current();
        if (tx == null) {
            throw new IllegalStateException("Policy writes require an active transaction");
        }
        return tx;
    }
}
