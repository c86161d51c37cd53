package tech.policyhub.rbac.common;

import org.jboss.logging.Logger;

/**
 * Binds a {@link PolicyTransaction} to the operation using it, together with
 * its {@link TransactionOwnership}.
 *
 * <p>Usage:
 * <pre>{@code
 * TransactionScope scope = TransactionScope.open(transactionProvider, externalTx);
 * try {
 *     adapter.addPolicy("p", "p", policy);
 *     scope.commit();
 * } catch (RuntimeException | Error e) {
 *     scope.rollback(e);
 *     throw e;
 * }
 * }</pre>
 */
public final class TransactionScope {

    private static final Logger LOG = Logger.getLogger(TransactionScope.class);

    private final PolicyTransaction transaction;
    private final TransactionOwnership ownership;

    private TransactionScope(PolicyTransaction transaction, TransactionOwnership ownership) {
        this.transaction = transaction;
        this.ownership = ownership;
    }

    /**
     * Use the caller's transaction if there is one, otherwise begin a new one
     * owned by this scope.
     *
     * @param provider    opens a transaction when {@code external} is null
     * @param external    caller-supplied transaction (may be null)
     */
    public static TransactionScope open(TransactionProvider provider, PolicyTransaction external) {
        if (external != null) {
            return new TransactionScope(external, TransactionOwnership.SUPPLIED_BY_CALLER);
        }
        return new TransactionScope(provider.begin(), TransactionOwnership.OWNED_BY_CALLEE);
    }

    public PolicyTransaction transaction() {
        return transaction;
    }

    public boolean isOwned() {
        return ownership == TransactionOwnership.OWNED_BY_CALLEE;
    }

    /**
     * Commit if this scope owns the transaction. No-op otherwise.
     */
    public void commit() {
        if (isOwned()) {
            transaction.commit();
        }
    }

    /**
     * Roll back if this scope owns the transaction. No-op otherwise.
     *
     * <p>A failing rollback is attached to {@code cause} as a suppressed
     * exception so the original error still reaches the caller.
     */
    public void rollback(Throwable cause) {
        if (!isOwned()) {
            return;
        }
        try {
            transaction.rollback(cause);
        } catch (RuntimeException rollbackError) {
            LOG.warnf(rollbackError, "Rollback failed after error: %s", String.valueOf(cause));
            if (cause != null && cause != rollbackError) {
                cause.addSuppressed(rollbackError);
            }
        }
    }
}
