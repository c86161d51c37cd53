package tech.policyhub.rbac.common;

/**
 * A unit of work spanning the policy tuple store and the role metadata store.
 *
 * <p>Whoever opened the transaction owns its lifecycle: only the opener calls
 * {@link #commit()} or {@link #rollback(Throwable)}. Code that receives a
 * transaction from its caller writes through it and lets errors propagate so
 * the opener can abort.
 *
 * <p>State outside the transactional stores (the in-memory role graph,
 * listener notifications) is changed through {@link #afterCommit(Runnable)},
 * so a rollback leaves it untouched.
 */
public interface PolicyTransaction {

    /**
     * Commit all writes made through this transaction, then run the
     * registered post-commit actions in registration order.
     *
     * @throws tech.policyhub.rbac.common.errors.PolicyStoreException if the commit fails
     */
    void commit();

    /**
     * Roll back all writes made through this transaction and discard the
     * registered post-commit actions.
     *
     * @param cause the error that aborted the unit of work (may be null)
     */
    void rollback(Throwable cause);

    /**
     * Register an action to run only after a successful commit.
     *
     * <p>Actions never run if the transaction rolls back. A failing action is
     * logged and does not prevent the remaining actions from running.
     */
    void afterCommit(Runnable action);

    /**
     * @return true while the transaction can still accept writes
     */
    boolean isActive();
}
