package tech.policyhub.rbac.authorization.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.policyhub.rbac.authorization.entity.PolicyRuleEntity;
import tech.policyhub.rbac.authorization.mapper.PolicyRuleMapper;

import java.util.List;

/**
 * Write-side repository for policy rule rows.
 */
@ApplicationScoped
public class PolicyRuleWriteRepository implements PanacheRepositoryBase<PolicyRuleEntity, Long> {

    /**
     * Persist the tuple unless an identical row exists.
     *
     * @return true if a row was inserted
     */
    public boolean persistRule(String ptype, List<String> rule) {
        PolicyRuleQuery query = PolicyRuleQuery.forRule(ptype, rule);
        if (count(query.where(), query.parameters()) > 0) {
            return false;
        }
        persist(PolicyRuleMapper.toEntity(ptype, rule));
        return true;
    }

    /**
     * @return number of rows deleted
     */
    public long deleteRule(String ptype, List<String> rule) {
        PolicyRuleQuery query = PolicyRuleQuery.forRule(ptype, rule);
        return delete(query.where(), query.parameters());
    }
}
