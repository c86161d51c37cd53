package tech.policyhub.rbac.authorization.events;

/**
 * Receives role notifications after the originating transaction committed.
 */
@FunctionalInterface
public interface RoleEventListener {

    void onRoleAdded(RoleAdded event);
}
