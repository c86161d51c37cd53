package tech.policyhub.rbac.common.jta;

import jakarta.transaction.HeuristicMixedException;
import jakarta.transaction.HeuristicRollbackException;
import jakarta.transaction.RollbackException;
import jakarta.transaction.Status;
import jakarta.transaction.Synchronization;
import jakarta.transaction.SystemException;
import jakarta.transaction.Transaction;
import jakarta.transaction.TransactionManager;
import org.jboss.logging.Logger;
import tech.policyhub.rbac.common.PolicyTransaction;
import tech.policyhub.rbac.common.errors.PolicyStoreException;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link PolicyTransaction} over a JTA {@link Transaction}.
 *
 * <p>Post-commit actions are registered as JTA {@link Synchronization}s that
 * only act when the completion status is {@link Status#STATUS_COMMITTED}.
 */
class JtaPolicyTransaction implements PolicyTransaction {

    private static final Logger LOG = Logger.getLogger(JtaPolicyTransaction.class);

    private final TransactionManager transactionManager;
    private final Transaction transaction;
    private final List<Runnable> postCommitActions = new ArrayList<>();

    JtaPolicyTransaction(TransactionManager transactionManager, Transaction transaction) {
        this.transactionManager = transactionManager;
        this.transaction = transaction;
    }

    @Override
    public void commit() {
        try {
            transactionManager.commit();
        } catch (RollbackException | HeuristicMixedException | HeuristicRollbackException | SystemException e) {
            throw new PolicyStoreException("Failed to commit transaction", e);
        }
    }

    @Override
    public void rollback(Throwable cause) {
        try {
            if (cause != null) {
                LOG.debugf("Rolling back transaction after %s", cause.getClass().getSimpleName());
            }
            transactionManager.rollback();
        } catch (SystemException e) {
            throw new PolicyStoreException("Failed to roll back transaction", e);
        }
    }

    @Override
    public void afterCommit(Runnable action) {
        if (postCommitActions.isEmpty()) {
            registerPostCommitRunner();
        }
        postCommitActions.add(action);
    }

    /**
     * One synchronization per transaction runs every action in registration
     * order once the transaction has committed.
     */
    private void registerPostCommitRunner() {
        try {
            transaction.registerSynchronization(new Synchronization() {
                @Override
                public void beforeCompletion() {
                    // No action needed before completion
                }

                @Override
                public void afterCompletion(int status) {
                    if (status != Status.STATUS_COMMITTED) {
                        LOG.debugf("Transaction completed with status=%d, skipping %d post-commit actions",
                            status, postCommitActions.size());
                        postCommitActions.clear();
                        return;
                    }
                    for (Runnable action : postCommitActions) {
                        try {
                            action.run();
                        } catch (RuntimeException e) {
                            LOG.warnf(e, "Post-commit action failed");
                        }
                    }
                    postCommitActions.clear();
                }
            });
        } catch (RollbackException | SystemException e) {
            throw new PolicyStoreException("Failed to register post-commit action", e);
        }
    }

    @Override
    public boolean isActive() {
        try {
            return transaction.getStatus() == Status.STATUS_ACTIVE;
        } catch (SystemException e) {
            throw new PolicyStoreException("Failed to read transaction status", e);
        }
    }
}
