package tech.policyhub.rbac.common;

/**
 * Opens {@link PolicyTransaction}s.
 */
public interface TransactionProvider {

    /**
     * Begin a new transaction. The caller owns it.
     */
    PolicyTransaction begin();
}
