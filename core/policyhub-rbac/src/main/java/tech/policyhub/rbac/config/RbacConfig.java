package tech.policyhub.rbac.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.List;

/**
 * RBAC engine configuration.
 */
@ConfigMapping(prefix = "rbac")
public interface RbacConfig {

    /**
     * Role whose metadata record is never deleted, even when its last
     * grouping policy is removed.
     */
    @WithDefault("role:default/rbac_admin")
    String adminRoleName();

    /**
     * Maximum number of inheritance hops followed when resolving roles.
     */
    @WithDefault("8")
    int maxHierarchyDepth();

    /**
     * Entity kinds treated as directly identified principals when
     * {@code enforce} runs without resolved roles.
     */
    @WithDefault("user,group")
    List<String> principalKinds();

    default boolean isAdminRole(String roleEntityRef) {
        return adminRoleName().equals(roleEntityRef);
    }
}
