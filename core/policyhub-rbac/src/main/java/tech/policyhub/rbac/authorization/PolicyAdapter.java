package tech.policyhub.rbac.authorization;

import java.util.List;

/**
 * Persistence for policy ("p") and grouping ("g") tuples.
 *
 * <p>Writes join the current {@link tech.policyhub.rbac.common.PolicyTransaction}.
 * Implementations must treat {@link #addPolicy} of an existing tuple as a
 * no-op.
 */
public interface PolicyAdapter {

    /**
     * Load every stored tuple matching at least one of the filters into the model.
     */
    void loadFilteredPolicy(PolicyModel model, List<PolicyFilter> filters);

    /**
     * Store a tuple.
     *
     * @param section the section key ("p" or "g")
     * @param ptype   the tuple type key ("p" or "g")
     * @param rule    the tuple fields
     */
    void addPolicy(String section, String ptype, List<String> rule);

    /**
     * Delete a tuple. Deleting a missing tuple is a no-op.
     */
    void removePolicy(String section, String ptype, List<String> rule);
}
