package tech.policyhub.rbac.authorization;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory rule set that filtered loads are written into.
 *
 * <p>Tuples are kept per {@link PolicyType}, de-duplicated by full tuple
 * equality and returned in insertion order. Instances are cheap and meant to
 * be created per call.
 */
public class PolicyModel {

    private final Map<PolicyType, Set<List<String>>> rules = new EnumMap<>(PolicyType.class);

    public PolicyModel() {
        for (PolicyType type : PolicyType.values()) {
            rules.put(type, new LinkedHashSet<>());
        }
    }

    /**
     * @return true if the tuple was not present before
     */
    public boolean addPolicy(PolicyType type, List<String> rule) {
        return rules.get(type).add(List.copyOf(rule));
    }

    public void addPolicies(PolicyType type, Collection<List<String>> rules) {
        for (List<String> rule : rules) {
            addPolicy(type, rule);
        }
    }

    public boolean hasPolicy(PolicyType type, List<String> rule) {
        return rules.get(type).contains(rule);
    }

    public boolean removePolicy(PolicyType type, List<String> rule) {
        return rules.get(type).remove(rule);
    }

    /**
     * Snapshot of the tuples of one type.
     */
    public List<List<String>> getPolicy(PolicyType type) {
        return new ArrayList<>(rules.get(type));
    }

    public int size(PolicyType type) {
        return rules.get(type).size();
    }

    public void clearPolicy() {
        rules.values().forEach(Set::clear);
    }
}
