package tech.policyhub.rbac.authorization.events;

/**
 * Notifications published by the policy delegate.
 */
public enum RoleEventType {
    /** A role metadata record was created, i.e. the role is new. */
    ROLE_ADDED
}
