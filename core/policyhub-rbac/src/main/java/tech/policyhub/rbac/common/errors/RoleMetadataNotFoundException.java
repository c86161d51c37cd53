package tech.policyhub.rbac.common.errors;

/**
 * Thrown when an operation targets a role that has no metadata record.
 */
public class RoleMetadataNotFoundException extends RuntimeException {

    private final String roleEntityRef;

    public RoleMetadataNotFoundException(String roleEntityRef) {
        super("Role metadata " + roleEntityRef + " was not found");
        this.roleEntityRef = roleEntityRef;
    }

    public String getRoleEntityRef() {
        return roleEntityRef;
    }
}
