package tech.policyhub.rbac.authorization.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.TypedQuery;
import org.jboss.logging.Logger;
import tech.policyhub.rbac.authorization.PolicyAdapter;
import tech.policyhub.rbac.authorization.PolicyFilter;
import tech.policyhub.rbac.authorization.PolicyModel;
import tech.policyhub.rbac.authorization.PolicyType;
import tech.policyhub.rbac.authorization.entity.PolicyRuleEntity;
import tech.policyhub.rbac.authorization.mapper.PolicyRuleMapper;
import tech.policyhub.rbac.common.errors.PolicyStoreException;

import java.util.List;
import java.util.Map;

/**
 * {@link PolicyAdapter} over the policy_rules table.
 * Reads use the EntityManager directly; writes go through {@link PolicyRuleWriteRepository}
 * and join the transaction active on the calling thread.
 */
@ApplicationScoped
public class PanachePolicyAdapter implements PolicyAdapter {

    private static final Logger LOG = Logger.getLogger(PanachePolicyAdapter.class);

    @Inject
    EntityManager em;

    @Inject
    PolicyRuleWriteRepository writeRepo;

    @Override
    public void loadFilteredPolicy(PolicyModel model, List<PolicyFilter> filters) {
        if (filters.isEmpty()) {
            return;
        }
        PolicyRuleQuery query = PolicyRuleQuery.forFilters(filters);
        try {
            TypedQuery<PolicyRuleEntity> typed = em.createQuery(
                "FROM PolicyRuleEntity WHERE " + query.where() + " ORDER BY id", PolicyRuleEntity.class);
            for (Map.Entry<String, Object> param : query.parameters().entrySet()) {
                typed.setParameter(param.getKey(), param.getValue());
            }
            List<PolicyRuleEntity> rows = typed.getResultList();
            for (PolicyRuleEntity row : rows) {
                model.addPolicy(PolicyType.fromKey(row.ptype), PolicyRuleMapper.toRule(row));
            }
            LOG.debugf("Loaded %d rules for %d filters", rows.size(), filters.size());
        } catch (PersistenceException e) {
            throw new PolicyStoreException("Failed to load policies for " + filters, e);
        }
    }

    @Override
    public void addPolicy(String section, String ptype, List<String> rule) {
        try {
            if (!writeRepo.persistRule(ptype, rule)) {
                LOG.debugf("Rule %s %s already stored", ptype, rule);
            }
        } catch (PersistenceException e) {
            throw new PolicyStoreException("Failed to store " + ptype + " rule " + rule, e);
        }
    }

    @Override
    public void removePolicy(String section, String ptype, List<String> rule) {
        try {
            writeRepo.deleteRule(ptype, rule);
        } catch (PersistenceException e) {
            throw new PolicyStoreException("Failed to remove " + ptype + " rule " + rule, e);
        }
    }
}
