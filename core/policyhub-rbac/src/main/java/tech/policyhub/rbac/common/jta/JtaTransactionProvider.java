package tech.policyhub.rbac.common.jta;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.NotSupportedException;
import jakarta.transaction.SystemException;
import jakarta.transaction.Transaction;
import jakarta.transaction.TransactionManager;
import tech.policyhub.rbac.common.PolicyTransaction;
import tech.policyhub.rbac.common.TransactionProvider;
import tech.policyhub.rbac.common.errors.PolicyStoreException;

/**
 * {@link TransactionProvider} backed by the Narayana JTA transaction manager.
 *
 * <p>The JPA-based policy adapter and role metadata repository join the
 * thread-bound JTA transaction, so every write issued between
 * {@link #begin()} and commit/rollback is part of one atomic unit.
 */
@ApplicationScoped
public class JtaTransactionProvider implements TransactionProvider {

    @Inject
    TransactionManager transactionManager;

    @Override
    public PolicyTransaction begin() {
        try {
            transactionManager.begin();
            Transaction transaction = transactionManager.getTransaction();
            return new JtaPolicyTransaction(transactionManager, transaction);
        } catch (NotSupportedException | SystemException e) {
            throw new PolicyStoreException("Failed to begin transaction", e);
        }
    }
}
