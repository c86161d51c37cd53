package tech.policyhub.rbac.authorization.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * JPA entity for policy_rules table.
 *
 * One row per stored tuple. Unused trailing fields are null.
 */
@Entity
@Table(name = "policy_rules")
public class PolicyRuleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    public Long id;

    @Column(name = "ptype", nullable = false, length = 8)
    public String ptype;

    @Column(name = "v0")
    public String v0;

    @Column(name = "v1")
    public String v1;

    @Column(name = "v2")
    public String v2;

    @Column(name = "v3")
    public String v3;

    @Column(name = "v4")
    public String v4;

    @Column(name = "v5")
    public String v5;

    public PolicyRuleEntity() {
    }
}
